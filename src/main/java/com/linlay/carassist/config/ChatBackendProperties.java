package com.linlay.carassist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "assistant.backend")
public class ChatBackendProperties {

    public static final String DEFAULT_APOLOGY =
            "Sorry, I couldn't reach the assistant service right now. Please try again in a moment.";

    private String authUrl = "https://ava.andrew-chat.com/api/v1/user";
    private String sessionUrl = "https://prism.andrew-chat.com/api/v1/prism";
    private String streamUrl = "wss://ava.andrew-chat.com/api/v1/stream";
    private String origin = "https://ava.andrew-chat.com";
    private String agentName = "ava";
    private String username;
    private String password;
    private String token;
    private long timeoutMs = 30_000L;
    private int maxAttempts = 4;
    private String apologyText = DEFAULT_APOLOGY;
    private InteractionLog interactionLog = new InteractionLog();

    public String getAuthUrl() {
        return authUrl;
    }

    public void setAuthUrl(String authUrl) {
        this.authUrl = authUrl;
    }

    public String getSessionUrl() {
        return sessionUrl;
    }

    public void setSessionUrl(String sessionUrl) {
        this.sessionUrl = sessionUrl;
    }

    public String getStreamUrl() {
        return streamUrl;
    }

    public void setStreamUrl(String streamUrl) {
        this.streamUrl = streamUrl;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public String getAgentName() {
        return agentName;
    }

    public void setAgentName(String agentName) {
        this.agentName = agentName;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public String getApologyText() {
        return apologyText;
    }

    public void setApologyText(String apologyText) {
        this.apologyText = apologyText == null || apologyText.isBlank() ? DEFAULT_APOLOGY : apologyText;
    }

    public InteractionLog getInteractionLog() {
        return interactionLog;
    }

    public void setInteractionLog(InteractionLog interactionLog) {
        this.interactionLog = interactionLog == null ? new InteractionLog() : interactionLog;
    }

    public static class InteractionLog {
        private boolean enabled = true;
        private boolean maskSensitive = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isMaskSensitive() {
            return maskSensitive;
        }

        public void setMaskSensitive(boolean maskSensitive) {
            this.maskSensitive = maskSensitive;
        }
    }
}
