package com.linlay.carassist.backend;

import java.util.Map;

/**
 * Wire operations of the conversational backend. Every method may throw
 * {@link BackendException}; retry decisions belong to {@link ChatBackendClient}.
 */
public interface ChatBackendGateway {

    /**
     * Logs in with the configured account and returns the authorization token.
     */
    String authenticate();

    /**
     * Returns the backend conversation id for {@code userId}, starting a fresh one when
     * {@code forceNew} is set.
     */
    String openSession(String userId, String token, boolean forceNew);

    SendOutcome send(String token, Map<String, Object> payload);

    void closeSession(String userId, String token, String sessionId);
}
