package com.tidypipe.client;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tidypipe.backend.manager.PipelineManager;
import com.tidypipe.backend.manager.ProgramRunner;
import com.tidypipe.backend.parser.PipelineParser;
import com.tidypipe.backend.parser.statement.Program;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.RunResult;

/**
 * 本地执行客户端：持有一个 {@link PipelineManager}，连续的运行共享其中发布的表。
 */
public class Client {

    private static final Logger LOGGER = LoggerFactory.getLogger(Client.class);

    private final ProgramRunner runner;
    private final PipelineManager manager;

    public Client(ProgramRunner runner, PipelineManager manager) {
        this.runner = runner;
        this.manager = manager;
    }

    /**
     * 解析并运行一个 program（或单个 pipeline）。
     *
     * @throws PipelineException 文本无法解析时抛出，运行期错误体现在返回结果中
     */
    public RunResult execute(String program) throws PipelineException {
        Program parsed = PipelineParser.parseProgram(program);
        return runner.run(parsed, manager);
    }

    public void reset() {
        manager.reset();
    }

    public List<String> names() {
        return manager.names();
    }

    public void close() {
        LOGGER.debug("[manager={}] Close client, {} table(s) registered", manager.getId(), manager.names().size());
        manager.reset();
    }
}
