package com.tidypipe.backend.engine;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tidypipe.backend.expr.Evaluator;
import com.tidypipe.backend.manager.PipelineManager;
import com.tidypipe.backend.parser.statement.Data;
import com.tidypipe.backend.parser.statement.Filter;
import com.tidypipe.backend.parser.statement.GroupBy;
import com.tidypipe.backend.parser.statement.Join;
import com.tidypipe.backend.parser.statement.Mutate;
import com.tidypipe.backend.parser.statement.Notify;
import com.tidypipe.backend.parser.statement.Pipeline;
import com.tidypipe.backend.parser.statement.Select;
import com.tidypipe.backend.parser.statement.Sequence;
import com.tidypipe.backend.parser.statement.Sort;
import com.tidypipe.backend.parser.statement.Summarize;
import com.tidypipe.backend.parser.statement.Transform;
import com.tidypipe.backend.parser.statement.Ungroup;
import com.tidypipe.backend.source.DataSource;
import com.tidypipe.backend.value.Table;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.RunResult;

/**
 * PipelineExecutor 按顺序执行 pipeline 中的操作，每个操作消费上一步产生的表，
 * 并返回结构化的 {@link RunResult}。
 * <p>
 * 特点：
 * <ul>
 *     <li>第一个操作必须是数据源（data / sequence / join）</li>
 *     <li>任一操作失败立即停止，丢弃部分结果，错误信息写入结果的 error</li>
 *     <li>失败之前已执行的 notify 仍然保留在 manager 中</li>
 * </ul>
 * 执行器本身无状态，跨运行的状态只存在于调用方传入的 {@link PipelineManager}。
 */
public class PipelineExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineExecutor.class);

    private final DataSource dataSource;
    private final Evaluator evaluator;

    public PipelineExecutor(DataSource dataSource, Evaluator evaluator) {
        this.dataSource = dataSource;
        this.evaluator = evaluator;
    }

    public PipelineExecutor(DataSource dataSource, EngineConfig config) {
        this(dataSource, new Evaluator(config.newEvalContext()));
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * 执行一个 pipeline，运行状态和结果会记录到 manager。
     */
    public RunResult run(Pipeline pipeline, PipelineManager manager) {
        LOGGER.info("[manager={}] Run pipeline: {}", manager.getId(), pipeline);
        manager.markRunning();
        long start = System.nanoTime();
        RunResult result;
        try {
            Table table = execute(pipeline, manager);
            result = RunResult.success(table, System.nanoTime() - start);
        } catch (PipelineException e) {
            LOGGER.warn("[manager={}] Pipeline failed ({}): {}", manager.getId(), e.getKind(), e.getMessage());
            result = RunResult.failure(e, System.nanoTime() - start);
        }
        manager.complete(result);
        return result;
    }

    private Table execute(Pipeline pipeline, PipelineManager manager) throws PipelineException {
        List<Transform> transforms = pipeline.getTransforms();
        if(transforms.isEmpty()) {
            throw Error.malformedPipeline("Pipeline is empty");
        }
        if(!transforms.get(0).isSource()) {
            throw Error.malformedPipeline("Pipeline must start with data, sequence or join, not "
                    + transforms.get(0).name());
        }
        Table current = null;
        for (int i = 0; i < transforms.size(); i++) {
            Transform t = transforms.get(i);
            if(i > 0 && (t instanceof Data || t instanceof Sequence)) {
                throw Error.malformedPipeline(t.name() + " may only appear as the first operation");
            }
            current = apply(t, current, manager);
            LOGGER.debug("[manager={}] {} -> {} rows", manager.getId(), t.name(), current.size());
        }
        return current;
    }

    private Table apply(Transform t, Table current, PipelineManager manager) throws PipelineException {
        if(t instanceof Data) {
            return load(((Data) t).dataset, manager);

        } else if(t instanceof Sequence) {
            Sequence seq = (Sequence) t;
            Table.Builder builder = Table.builder(List.of(seq.column));
            for (int i = 1; i <= seq.count; i++) {
                builder.addRow((double) i);
            }
            return builder.build();

        } else if(t instanceof Join) {
            Join join = (Join) t;
            Table left = manager.lookup(join.leftName);
            Table right = manager.lookup(join.rightName);
            return Joiner.join(left, join.leftColumn, right, join.rightColumn);

        } else if(t instanceof Filter) {
            return TableOperations.filter(current, ((Filter) t).predicate, evaluator);

        } else if(t instanceof Mutate) {
            Mutate m = (Mutate) t;
            return TableOperations.mutate(current, m.column, m.value, evaluator);

        } else if(t instanceof Select) {
            return TableOperations.select(current, ((Select) t).columns);

        } else if(t instanceof Sort) {
            Sort s = (Sort) t;
            return TableOperations.sort(current, s.columns, s.descending);

        } else if(t instanceof GroupBy) {
            return TableOperations.groupBy(current, ((GroupBy) t).column);

        } else if(t instanceof Ungroup) {
            return TableOperations.ungroup(current);

        } else if(t instanceof Summarize) {
            return TableOperations.summarize(current, ((Summarize) t).items);

        } else if(t instanceof Notify) {
            manager.register(((Notify) t).target, current);
            return current;
        }
        throw Error.malformedPipeline("Unsupported operation " + t.name());
    }

    /**
     * 先查数据源，再查 manager 中已发布的表。
     */
    private Table load(String name, PipelineManager manager) throws PipelineException {
        if(dataSource.contains(name)) {
            return dataSource.load(name);
        }
        if(manager.contains(name)) {
            return manager.lookup(name);
        }
        throw Error.unknownDataset(name);
    }
}
