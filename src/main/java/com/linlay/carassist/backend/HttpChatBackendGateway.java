package com.linlay.carassist.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.carassist.config.ChatBackendProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

@Component
public class HttpChatBackendGateway implements ChatBackendGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpChatBackendGateway.class);

    private final ChatBackendProperties properties;
    private final WebClient webClient;
    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final BackendCallLogger callLogger;

    public HttpChatBackendGateway(
            ChatBackendProperties properties,
            WebClient.Builder loggingWebClientBuilder,
            WebSocketClient backendWebSocketClient,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.webClient = loggingWebClientBuilder.clone().build();
        this.webSocketClient = backendWebSocketClient;
        this.objectMapper = objectMapper;
        this.callLogger = new BackendCallLogger(properties.getInteractionLog());
    }

    @Override
    public String authenticate() {
        if (!StringUtils.hasText(properties.getUsername()) || !StringUtils.hasText(properties.getPassword())) {
            throw new BackendException("No password provided and no token set.");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", properties.getUsername());
        body.put("password", properties.getPassword());
        JsonNode response = call(() -> webClient.post()
                .uri(properties.getAuthUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class), "login");
        String token = response == null ? "" : response.path("authorization").asText("");
        if (!StringUtils.hasText(token)) {
            throw new BackendException("login response carried no authorization");
        }
        return token;
    }

    @Override
    public String openSession(String userId, String token, boolean forceNew) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(properties.getSessionUrl())
                .pathSegment("get_session", userId, properties.getAgentName());
        if (forceNew) {
            uri.queryParam("new", "true");
        }
        URI target = uri.encode().build().toUri();
        JsonNode response = call(() -> webClient.get()
                .uri(target)
                .header(HttpHeaders.AUTHORIZATION, token)
                .retrieve()
                .bodyToMono(JsonNode.class), "get_session");
        JsonNode id = response == null ? null : response.get("id");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            throw new BackendException("session response carried no id");
        }
        return id.asText();
    }

    @Override
    public SendOutcome send(String token, Map<String, Object> payload) {
        String message;
        try {
            message = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new BackendException("cannot encode payload", ex);
        }
        URI uri = UriComponentsBuilder.fromUriString(properties.getStreamUrl())
                .queryParam("token", token)
                .encode()
                .build()
                .toUri();
        HttpHeaders headers = new HttpHeaders();
        if (StringUtils.hasText(properties.getOrigin())) {
            headers.setOrigin(properties.getOrigin());
        }

        String traceId = callLogger.generateTraceId();
        long startNanos = System.nanoTime();
        callLogger.debug(log, "[{}] stream request {}", traceId, callLogger.preview(message));
        StreamCollector collector = new StreamCollector(objectMapper);
        try {
            webSocketClient.execute(uri, headers, session -> session.send(Mono.just(session.textMessage(message)))
                            .thenMany(session.receive()
                                    .map(WebSocketMessage::getPayloadAsText)
                                    .takeUntil(collector::accept))
                            .then(session.close()))
                    .block(timeout());
        } catch (RuntimeException ex) {
            throw new BackendException("stream failed: " + ex.getMessage(), ex);
        }
        SendOutcome outcome = collector.outcome();
        callLogger.info(log, "[{}] stream finished chars={} badRequest={} elapsedMs={}",
                traceId, outcome.text().length(), outcome.badRequest(), callLogger.elapsedMs(startNanos));
        callLogger.debug(log, "[{}] stream response {}", traceId, callLogger.preview(outcome.text()));
        return outcome;
    }

    @Override
    public void closeSession(String userId, String token, String sessionId) {
        URI target = UriComponentsBuilder.fromUriString(properties.getSessionUrl())
                .pathSegment("close", userId, sessionId)
                .encode()
                .build()
                .toUri();
        call(() -> webClient.post()
                .uri(target)
                .header(HttpHeaders.AUTHORIZATION, token)
                .retrieve()
                .toBodilessEntity()
                .then(Mono.<JsonNode>empty()), "close_session");
    }

    private JsonNode call(Supplier<Mono<JsonNode>> request, String operation) {
        try {
            return request.get().block(timeout());
        } catch (RuntimeException ex) {
            throw new BackendException(operation + " failed: " + ex.getMessage(), ex);
        }
    }

    private Duration timeout() {
        return Duration.ofMillis(Math.max(1L, properties.getTimeoutMs()));
    }
}
