package com.linlay.carassist.backend;

public record BackendSession(String authToken, String externalSessionId) {

    public static BackendSession unbound() {
        return new BackendSession(null, null);
    }

    public boolean authenticated() {
        return authToken != null;
    }

    public boolean bound() {
        return externalSessionId != null;
    }

    public BackendSession withToken(String token) {
        return new BackendSession(token, externalSessionId);
    }

    public BackendSession withSession(String sessionId) {
        return new BackendSession(authToken, sessionId);
    }
}
