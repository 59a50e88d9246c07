package com.linlay.carassist.backend;

import com.linlay.carassist.config.ChatBackendProperties;
import org.springframework.stereotype.Component;

@Component
public class ChatBackendClientFactory {

    private final ChatBackendGateway gateway;
    private final ChatBackendProperties properties;
    private final BackendCallLogger callLogger;

    public ChatBackendClientFactory(ChatBackendGateway gateway, ChatBackendProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
        this.callLogger = new BackendCallLogger(properties.getInteractionLog());
    }

    public ChatBackendClient create(String userId) {
        return new ChatBackendClient(
                gateway,
                new BackendRetryPolicy(properties.getMaxAttempts()),
                callLogger,
                userId,
                properties.getToken(),
                properties.getApologyText()
        );
    }
}
