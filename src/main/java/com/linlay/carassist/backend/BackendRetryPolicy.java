package com.linlay.carassist.backend;

/**
 * Escalation for sends that come back empty. Attempt 1 sends on the bound session, attempt 2
 * resends on it, and every later attempt first replaces the external session. Once the attempt
 * budget is spent the caller answers with the apology text.
 */
public final class BackendRetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 4;

    public enum Step {
        SEND,
        RESEND,
        RECREATE_SESSION_AND_SEND,
        GIVE_UP
    }

    private final int maxAttempts;

    public BackendRetryPolicy(int maxAttempts) {
        this.maxAttempts = maxAttempts <= 0 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * What to do for the given 1-based attempt number.
     */
    public Step stepFor(int attempt) {
        if (attempt > maxAttempts) {
            return Step.GIVE_UP;
        }
        if (attempt <= 1) {
            return Step.SEND;
        }
        if (attempt == 2) {
            return Step.RESEND;
        }
        return Step.RECREATE_SESSION_AND_SEND;
    }
}
