package com.linlay.carassist.session;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId + ". Please initialize session first.");
    }
}
