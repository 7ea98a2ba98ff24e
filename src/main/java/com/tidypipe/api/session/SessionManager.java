package com.tidypipe.api.session;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import javax.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tidypipe.api.config.TidyPipeConfig;
import com.tidypipe.api.exception.SessionNotFoundException;
import com.tidypipe.backend.source.DataSource;

/**
 * 维护 sessionId 到会话的映射。
 */
@Component
public class SessionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, PipelineSession> sessions = new ConcurrentHashMap<>();
    private final DataSource dataSource;
    private final TidyPipeConfig config;

    public SessionManager(DataSource dataSource, TidyPipeConfig config) {
        this.dataSource = dataSource;
        this.config = config;
    }

    public String createSession() {
        String sessionId = UUID.randomUUID().toString();
        sessions.put(sessionId, new PipelineSessionImpl(sessionId, dataSource, config.toEngineConfig()));
        LOGGER.info("Session created: {}", sessionId);
        return sessionId;
    }

    public PipelineSession getSession(String sessionId) {
        PipelineSession session = sessions.get(sessionId);
        if(session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public boolean closeSession(String sessionId) {
        PipelineSession session = sessions.remove(sessionId);
        if(session == null) {
            return false;
        }
        session.close();
        LOGGER.info("Session closed: {}", sessionId);
        return true;
    }

    @PreDestroy
    public void closeAll() {
        for (String sessionId : sessions.keySet()) {
            closeSession(sessionId);
        }
    }
}
