package com.linlay.carassist.geo;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.carassist.config.GeoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Component
public class DistanceMatrixClient {

    private static final Logger log = LoggerFactory.getLogger(DistanceMatrixClient.class);

    private final GeoProperties properties;
    private final WebClient webClient;

    public DistanceMatrixClient(GeoProperties properties, WebClient.Builder loggingWebClientBuilder) {
        this.properties = properties;
        this.webClient = loggingWebClientBuilder.clone().build();
    }

    public Optional<DistanceMatch> closest(String origin, List<String> destinations) {
        if (!StringUtils.hasText(properties.getApiKey()) || destinations == null || destinations.isEmpty()) {
            return Optional.empty();
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getDistanceMatrixUrl())
                .queryParam("origins", origin)
                .queryParam("destinations", String.join("|", destinations))
                .queryParam("mode", "driving")
                .queryParam("key", properties.getApiKey())
                .encode()
                .build()
                .toUri();
        JsonNode body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofMillis(Math.max(1L, properties.getTimeoutMs())));
        } catch (RuntimeException ex) {
            log.warn("Distance matrix call failed for {} destinations: {}", destinations.size(), ex.getMessage());
            return Optional.empty();
        }
        return pickBest(body, destinations);
    }

    static Optional<DistanceMatch> pickBest(JsonNode body, List<String> destinations) {
        if (body == null || !"OK".equals(body.path("status").asText()) || !body.path("rows").isArray()
                || body.path("rows").isEmpty()) {
            return Optional.empty();
        }
        JsonNode elements = body.path("rows").get(0).path("elements");
        int bestIndex = -1;
        double bestMeters = Double.MAX_VALUE;
        for (int i = 0; i < elements.size() && i < destinations.size(); i++) {
            JsonNode element = elements.get(i);
            if (!"OK".equals(element.path("status").asText())) {
                continue;
            }
            double meters = element.path("distance").path("value").asDouble(Double.MAX_VALUE);
            if (meters < bestMeters) {
                bestIndex = i;
                bestMeters = meters;
            }
        }
        if (bestIndex < 0) {
            return Optional.empty();
        }
        String duration = elements.get(bestIndex).path("duration").path("text").asText("");
        return Optional.of(new DistanceMatch(destinations.get(bestIndex), bestMeters, duration));
    }
}
