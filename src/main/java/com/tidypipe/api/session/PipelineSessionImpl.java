package com.tidypipe.api.session;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import com.tidypipe.backend.engine.EngineConfig;
import com.tidypipe.backend.engine.PipelineExecutor;
import com.tidypipe.backend.manager.PipelineManager;
import com.tidypipe.backend.manager.ProgramRunner;
import com.tidypipe.backend.parser.PipelineParser;
import com.tidypipe.backend.parser.statement.Program;
import com.tidypipe.backend.source.DataSource;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.RunResult;

/**
 * 一个会话独占一个 {@link PipelineManager}，会话内的运行通过锁串行化。
 */
public class PipelineSessionImpl implements PipelineSession {

    private final PipelineManager manager;
    private final ProgramRunner runner;
    private final Object runLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PipelineSessionImpl(String sessionId, DataSource dataSource, EngineConfig config) {
        this.manager = new PipelineManager(sessionId);
        this.runner = new ProgramRunner(new PipelineExecutor(dataSource, config));
    }

    @Override
    public RunResult run(String program) throws PipelineException {
        ensureOpen();
        String text = Objects.requireNonNull(program, "program must not be null").trim();
        Program parsed = PipelineParser.parseProgram(text);
        // 同一会话的注册表不允许并发运行
        synchronized (runLock) {
            return runner.run(parsed, manager);
        }
    }

    @Override
    public void reset() {
        ensureOpen();
        synchronized (runLock) {
            manager.reset();
        }
    }

    @Override
    public List<String> names() {
        ensureOpen();
        synchronized (runLock) {
            return manager.names();
        }
    }

    @Override
    public void close() {
        if(!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (runLock) {
            manager.reset();
        }
    }

    private void ensureOpen() {
        if(closed.get()) {
            throw new IllegalStateException("Session " + manager.getId() + " already closed");
        }
    }
}
