package com.linlay.carassist.session;

import com.linlay.carassist.backend.ChatBackendClient;

import java.util.concurrent.locks.ReentrantLock;

public class SessionState {

    private final SessionContext context;
    private final TurnLog log;
    private final ChatBackendClient backendClient;
    private final ReentrantLock turnLock = new ReentrantLock();

    public SessionState(SessionContext context, TurnLog log, ChatBackendClient backendClient) {
        this.context = context;
        this.log = log;
        this.backendClient = backendClient;
    }

    public SessionContext context() {
        return context;
    }

    public TurnLog log() {
        return log;
    }

    public ChatBackendClient backendClient() {
        return backendClient;
    }

    public ReentrantLock turnLock() {
        return turnLock;
    }
}
