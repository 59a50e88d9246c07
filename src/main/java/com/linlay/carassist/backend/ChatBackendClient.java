package com.linlay.carassist.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Conversational backend access for one user session. Login and the external session are
 * acquired lazily and cached; {@link #ask} walks the {@link BackendRetryPolicy} and never throws.
 * At most one external session is bound at a time.
 */
public class ChatBackendClient {

    private static final Logger log = LoggerFactory.getLogger(ChatBackendClient.class);

    private final ChatBackendGateway gateway;
    private final BackendRetryPolicy retryPolicy;
    private final BackendCallLogger callLogger;
    private final String userId;
    private final String preIssuedToken;
    private final String apologyText;

    private BackendSession session = BackendSession.unbound();

    public ChatBackendClient(
            ChatBackendGateway gateway,
            BackendRetryPolicy retryPolicy,
            BackendCallLogger callLogger,
            String userId,
            String preIssuedToken,
            String apologyText
    ) {
        this.gateway = gateway;
        this.retryPolicy = retryPolicy;
        this.callLogger = callLogger;
        this.userId = userId;
        this.preIssuedToken = StringUtils.hasText(preIssuedToken) ? preIssuedToken.trim() : null;
        this.apologyText = apologyText;
    }

    public String userId() {
        return userId;
    }

    public synchronized BackendSession currentSession() {
        return session;
    }

    /**
     * Sends one prompt. Empty replies escalate per the retry policy; when every attempt is spent
     * the reply carries the apology text and {@code delivered=false}.
     */
    public synchronized ChatReply ask(String prompt) {
        String traceId = callLogger.generateTraceId();
        long startNanos = System.nanoTime();
        int attempt = 1;
        while (true) {
            BackendRetryPolicy.Step step = retryPolicy.stepFor(attempt);
            if (step == BackendRetryPolicy.Step.GIVE_UP) {
                break;
            }
            if (step == BackendRetryPolicy.Step.RECREATE_SESSION_AND_SEND) {
                callLogger.info(log, "[{}] user={} attempt={} recreating backend session", traceId, userId, attempt);
                recreateSession();
            }
            String text = sendOnce(prompt, traceId, attempt);
            if (!text.isEmpty()) {
                callLogger.info(log, "[{}] user={} delivered on attempt={} chars={} elapsedMs={}",
                        traceId, userId, attempt, text.length(), callLogger.elapsedMs(startNanos));
                return ChatReply.delivered(text, attempt);
            }
            attempt++;
        }
        int attempts = retryPolicy.maxAttempts();
        callLogger.warn(log, "[{}] user={} no reply after {} attempts elapsedMs={}",
                traceId, userId, attempts, callLogger.elapsedMs(startNanos));
        return ChatReply.apology(apologyText, attempts);
    }

    /**
     * Logs in and binds a brand-new external session.
     *
     * @throws BackendException if either call fails
     */
    public synchronized String warmUp() {
        String token = ensureToken();
        String sessionId = gateway.openSession(userId, token, true);
        session = session.withSession(sessionId);
        callLogger.info(log, "user={} bound backend session {}", userId, BackendCallLogger.shortId(sessionId));
        return sessionId;
    }

    /**
     * Best-effort close of the bound external session.
     */
    public synchronized void close() {
        if (!session.bound() || !session.authenticated()) {
            session = BackendSession.unbound();
            return;
        }
        try {
            gateway.closeSession(userId, session.authToken(), session.externalSessionId());
        } catch (RuntimeException ex) {
            callLogger.warn(log, "user={} close of backend session {} failed: {}",
                    userId, BackendCallLogger.shortId(session.externalSessionId()), callLogger.preview(ex.getMessage()));
        }
        session = BackendSession.unbound();
    }

    private String sendOnce(String prompt, String traceId, int attempt) {
        String token;
        String sessionId;
        try {
            token = ensureToken();
            sessionId = ensureSession(token);
        } catch (RuntimeException ex) {
            callLogger.warn(log, "[{}] user={} attempt={} backend unavailable: {}",
                    traceId, userId, attempt, callLogger.preview(ex.getMessage()));
            return "";
        }
        for (PayloadShape shape : PayloadShape.values()) {
            try {
                SendOutcome outcome = gateway.send(token, shape.build(userId, sessionId, prompt));
                if (outcome.delivered()) {
                    return outcome.text().strip();
                }
                callLogger.info(log, "[{}] user={} attempt={} shape={} empty={} badRequest={}",
                        traceId, userId, attempt, shape, outcome.text().isBlank(), outcome.badRequest());
            } catch (RuntimeException ex) {
                callLogger.warn(log, "[{}] user={} attempt={} shape={} send failed: {}",
                        traceId, userId, attempt, shape, callLogger.preview(ex.getMessage()));
            }
        }
        return "";
    }

    private void recreateSession() {
        close();
        try {
            String token = ensureToken();
            String sessionId = gateway.openSession(userId, token, true);
            session = session.withSession(sessionId);
            callLogger.info(log, "user={} rebound backend session {}", userId, BackendCallLogger.shortId(sessionId));
        } catch (RuntimeException ex) {
            callLogger.warn(log, "user={} could not recreate backend session: {}", userId, callLogger.preview(ex.getMessage()));
        }
    }

    private String ensureToken() {
        if (session.authenticated()) {
            return session.authToken();
        }
        String token = preIssuedToken != null ? preIssuedToken : gateway.authenticate();
        session = session.withToken(token);
        return token;
    }

    private String ensureSession(String token) {
        if (session.bound()) {
            return session.externalSessionId();
        }
        String sessionId = gateway.openSession(userId, token, false);
        session = session.withSession(sessionId);
        return sessionId;
    }
}
