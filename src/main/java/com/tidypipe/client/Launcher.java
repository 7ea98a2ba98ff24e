package com.tidypipe.client;

import com.tidypipe.backend.engine.EngineConfig;
import com.tidypipe.backend.engine.PipelineExecutor;
import com.tidypipe.backend.manager.PipelineManager;
import com.tidypipe.backend.manager.ProgramRunner;
import com.tidypipe.backend.source.InMemoryDataSource;

public class Launcher {
    public static void main(String[] args) {
        EngineConfig config = EngineConfig.fromSystemProperties();
        PipelineExecutor executor = new PipelineExecutor(InMemoryDataSource.withBuiltins(), config);
        Client client = new Client(new ProgramRunner(executor), new PipelineManager("console"));
        Shell shell = new Shell(client);
        shell.run();
    }
}
