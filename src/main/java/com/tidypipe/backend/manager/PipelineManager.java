package com.tidypipe.backend.manager;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tidypipe.backend.value.Table;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.RunResult;

/**
 * 管理 notify 发布的表快照，以及最近一次运行的状态和结果。
 * <p>
 * 注册表在多次运行之间保留，只有显式调用 {@link #reset()} 才会清空；
 * 开始一组新的相互依赖的 pipeline 之前必须先 reset，否则上一轮的表仍然可见。
 * 本类不是线程安全的，并发宿主需要在外部串行化对同一个实例的访问。
 */
public class PipelineManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineManager.class);

    public enum RunState {
        IDLE,
        RUNNING,
        SUCCESS,
        FAILED
    }

    /** 用于日志的标识（会话 ID 或 console），允许为空 */
    private final String id;
    private final Map<String, Table> registry = new LinkedHashMap<>();
    private RunState state = RunState.IDLE;
    private RunResult lastResult;

    public PipelineManager(String id) {
        this.id = id;
    }

    public PipelineManager() {
        this("default");
    }

    public String getId() {
        return id;
    }

    /**
     * 插入或覆盖。
     */
    public void register(String name, Table table) {
        Table previous = registry.put(name, table);
        LOGGER.debug("[manager={}] {} {} ({} rows)", id, previous == null ? "Register" : "Overwrite",
                name, table.size());
    }

    public Table lookup(String name) throws PipelineException {
        Table table = registry.get(name);
        if(table == null) {
            throw Error.unknownRegistryName(name);
        }
        return table;
    }

    public boolean contains(String name) {
        return registry.containsKey(name);
    }

    /** 已注册的名字，按首次注册顺序 */
    public List<String> names() {
        return new ArrayList<>(registry.keySet());
    }

    /**
     * 清空所有注册的表以及运行状态。
     */
    public void reset() {
        registry.clear();
        state = RunState.IDLE;
        lastResult = null;
        LOGGER.info("[manager={}] Reset", id);
    }

    public RunState getState() {
        return state;
    }

    /** 最近一次运行的结果，尚未运行或 reset 之后为 null */
    public RunResult getLastResult() {
        return lastResult;
    }

    /** 最近一次运行的错误信息，成功或未运行时为空串 */
    public String getLastError() {
        return lastResult == null ? "" : lastResult.getError();
    }

    public void markRunning() {
        state = RunState.RUNNING;
    }

    public void complete(RunResult result) {
        lastResult = result;
        state = result.isSuccess() ? RunState.SUCCESS : RunState.FAILED;
    }
}
