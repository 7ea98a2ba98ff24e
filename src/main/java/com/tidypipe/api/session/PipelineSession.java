package com.tidypipe.api.session;

import java.util.List;

import com.tidypipe.common.PipelineException;
import com.tidypipe.common.RunResult;

public interface PipelineSession {
    RunResult run(String program) throws PipelineException;
    void reset();
    List<String> names();
    void close();
}
