package com.tidypipe.backend.manager;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tidypipe.backend.engine.PipelineExecutor;
import com.tidypipe.backend.parser.statement.Pipeline;
import com.tidypipe.backend.parser.statement.Program;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.RunResult;

/**
 * 按顺序运行 program 中的 pipeline。
 * <p>
 * join 的输入还没有发布的 pipeline 会被推迟，等依赖的表 notify 之后再运行。
 * 第一个失败的 pipeline 终止整个 program；剩下的 pipeline 都在等待永远不会发布的表时，
 * 以 UNRESOLVED_DEPENDENCY 失败。返回最后一个执行的 pipeline 的结果。
 * 运行前不会自动 reset manager。
 */
public class ProgramRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProgramRunner.class);

    private final PipelineExecutor executor;

    public ProgramRunner(PipelineExecutor executor) {
        this.executor = executor;
    }

    public PipelineExecutor getExecutor() {
        return executor;
    }

    public RunResult run(Program program, PipelineManager manager) {
        long start = System.nanoTime();
        List<Pipeline> pending = new ArrayList<>(program.getPipelines());
        if(pending.isEmpty()) {
            return fail(manager, Error.malformedPipeline("Program contains no pipeline"), start);
        }
        LOGGER.info("[manager={}] Run program with {} pipeline(s)", manager.getId(), pending.size());
        RunResult last = null;
        while (!pending.isEmpty()) {
            Pipeline next = nextRunnable(pending, manager);
            if(next == null) {
                return fail(manager, Error.unresolvedDependency(missing(pending, manager)), start);
            }
            last = executor.run(next, manager);
            if(!last.isSuccess()) {
                return last;
            }
        }
        return last;
    }

    /**
     * 取出第一个依赖已全部满足的 pipeline，没有则返回 null。
     */
    private Pipeline nextRunnable(List<Pipeline> pending, PipelineManager manager) {
        Iterator<Pipeline> it = pending.iterator();
        while (it.hasNext()) {
            Pipeline p = it.next();
            boolean ready = true;
            for (String name : p.requires()) {
                if(!manager.contains(name)) {
                    ready = false;
                    break;
                }
            }
            if(ready) {
                it.remove();
                return p;
            }
            LOGGER.debug("[manager={}] Defer pipeline: {}", manager.getId(), p);
        }
        return null;
    }

    private Set<String> missing(List<Pipeline> pending, PipelineManager manager) {
        Set<String> names = new LinkedHashSet<>();
        for (Pipeline p : pending) {
            for (String name : p.requires()) {
                if(!manager.contains(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private RunResult fail(PipelineManager manager, PipelineException e, long start) {
        LOGGER.warn("[manager={}] Program failed ({}): {}", manager.getId(), e.getKind(), e.getMessage());
        RunResult result = RunResult.failure(e, System.nanoTime() - start);
        manager.complete(result);
        return result;
    }
}
