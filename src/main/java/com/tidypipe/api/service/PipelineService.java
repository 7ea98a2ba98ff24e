package com.tidypipe.api.service;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.tidypipe.api.entity.RunTableResult;
import com.tidypipe.api.entity.enums.ResponseFormat;
import com.tidypipe.api.entity.response.RunResponse;
import com.tidypipe.api.session.PipelineSession;
import com.tidypipe.api.session.SessionManager;
import com.tidypipe.common.ConsoleResultFormatter;
import com.tidypipe.common.PipelineException;
import com.tidypipe.common.ResultFormatter;
import com.tidypipe.common.RunResult;

@Service
public class PipelineService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineService.class);

    private final SessionManager sessionManager;
    private final ResultFormatter formatter = new ConsoleResultFormatter();

    public PipelineService(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    public RunResponse<?> runWithSession(String sessionId, String program, ResponseFormat format) {
        PipelineSession session = sessionManager.getSession(sessionId);
        RunResult result;
        try {
            result = session.run(program);
        } catch (PipelineException ex) {
            LOGGER.warn("Rejected program for session {} ({}): {}", sessionId, ex.getKind(), ex.getMessage());
            return RunResponse.failure(ex.getMessage());
        }
        if(!result.isSuccess()) {
            return RunResponse.failure(result.getError());
        }
        if(format == ResponseFormat.TEXT) {
            return RunResponse.success(new String(formatter.format(result), StandardCharsets.UTF_8));
        }
        return RunResponse.success(RunTableResult.from(result));
    }

    public void reset(String sessionId) {
        sessionManager.getSession(sessionId).reset();
    }

    public List<String> names(String sessionId) {
        return sessionManager.getSession(sessionId).names();
    }
}
