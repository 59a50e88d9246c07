package com.linlay.carassist.config;

import com.linlay.carassist.backend.BackendLogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

@Configuration
public class HttpClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfiguration.class);

    @Bean
    public ConnectionProvider backendConnectionProvider() {
        return ConnectionProvider.builder("assistant-backend-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public WebClient.Builder loggingWebClientBuilder(
            ChatBackendProperties backendProperties,
            ConnectionProvider backendConnectionProvider) {
        HttpClient httpClient = HttpClient.create(backendConnectionProvider)
                .responseTimeout(Duration.ofMillis(Math.max(1L, backendProperties.getTimeoutMs())));

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                        .build());
        ChatBackendProperties.InteractionLog logProperties = backendProperties.getInteractionLog();
        if (!logProperties.isEnabled()) {
            return builder;
        }

        boolean maskSensitive = logProperties.isMaskSensitive();
        return builder.filter((request, next) -> {
            log.info("[backend-http][request] {} {}", request.method(), BackendLogSanitizer.maskText(request.url().toString(), maskSensitive));
            log.debug("[backend-http][request-headers] {}", BackendLogSanitizer.maskHeaders(request.headers(), maskSensitive));
            return next.exchange(request)
                    .doOnNext(logResponse(maskSensitive, request));
        });
    }

    @Bean
    public WebSocketClient backendWebSocketClient(ConnectionProvider backendConnectionProvider) {
        return new ReactorNettyWebSocketClient(HttpClient.create(backendConnectionProvider));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private Consumer<ClientResponse> logResponse(boolean maskSensitive, ClientRequest request) {
        return response -> log.info(
                "[backend-http][response] {} {} status={}",
                request.method(),
                BackendLogSanitizer.maskText(request.url().toString(), maskSensitive),
                response.statusCode().value()
        );
    }
}
