package com.tidypipe.api.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session does not exist or has been closed: " + sessionId);
    }
}
