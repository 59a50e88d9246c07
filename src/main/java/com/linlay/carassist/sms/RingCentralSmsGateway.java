package com.linlay.carassist.sms;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.carassist.config.SmsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Component
public class RingCentralSmsGateway implements SmsGateway {

    private static final Logger log = LoggerFactory.getLogger(RingCentralSmsGateway.class);

    static final String TOKEN_PATH = "/restapi/oauth/token";
    static final String PHONE_NUMBER_PATH = "/restapi/v1.0/account/~/extension/~/phone-number";
    static final String SMS_PATH = "/restapi/v1.0/account/~/extension/~/sms";
    private static final String JWT_GRANT = "urn:ietf:params:oauth:grant-type:jwt-bearer";

    private final SmsProperties properties;
    private final WebClient webClient;
    private volatile String accessToken;

    public RingCentralSmsGateway(SmsProperties properties, WebClient.Builder loggingWebClientBuilder) {
        this.properties = properties;
        this.webClient = loggingWebClientBuilder.clone()
                .baseUrl(properties.getServerUrl())
                .build();
    }

    @Override
    public void send(String toNumber, String text) {
        if (!StringUtils.hasText(toNumber)) {
            throw new SmsDeliveryException("no receiver number");
        }
        try {
            JsonNode numbers = withLogin(token -> get(PHONE_NUMBER_PATH, token));
            String fromNumber = smsSender(numbers);
            if (fromNumber == null) {
                throw new SmsDeliveryException("No SMS-capable number found for this account.");
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("from", Map.of("phoneNumber", fromNumber));
            body.put("to", List.of(Map.of("phoneNumber", toNumber)));
            body.put("text", text);
            JsonNode sent = withLogin(token -> post(SMS_PATH, token, body));
            log.info("Escalation SMS accepted id={}", sent == null ? "-" : sent.path("id").asText("-"));
        } catch (WebClientResponseException ex) {
            throw new SmsDeliveryException(ex.getStatusCode().value() + " " + ex.getStatusText(), ex);
        } catch (SmsDeliveryException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new SmsDeliveryException(String.valueOf(ex.getMessage()), ex);
        }
    }

    private JsonNode withLogin(Function<String, JsonNode> call) {
        String token = accessToken;
        if (token == null) {
            token = login();
        }
        try {
            return call.apply(token);
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
                throw ex;
            }
            log.info("RingCentral token rejected, logging in again");
            return call.apply(login());
        }
    }

    private synchronized String login() {
        if (!StringUtils.hasText(properties.getClientId()) || !StringUtils.hasText(properties.getJwt())) {
            throw new SmsDeliveryException("Unable to authenticate. SMS credentials are not configured.");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", JWT_GRANT);
        form.add("assertion", properties.getJwt());
        JsonNode response = webClient.post()
                .uri(TOKEN_PATH)
                .headers(headers -> headers.setBasicAuth(properties.getClientId(), nullToEmpty(properties.getClientSecret())))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout());
        String token = response == null ? "" : response.path("access_token").asText("");
        if (!StringUtils.hasText(token)) {
            throw new SmsDeliveryException("Unable to authenticate. Check credentials.");
        }
        accessToken = token;
        return token;
    }

    private JsonNode get(String path, String token) {
        return webClient.get()
                .uri(path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout());
    }

    private JsonNode post(String path, String token, Object body) {
        return webClient.post()
                .uri(path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout());
    }

    static String smsSender(JsonNode numbers) {
        if (numbers == null) {
            return null;
        }
        for (JsonNode entry : numbers.path("records")) {
            for (JsonNode feature : entry.path("features")) {
                if ("SmsSender".equals(feature.asText())) {
                    String number = entry.path("phoneNumber").asText("");
                    return StringUtils.hasText(number) ? number : null;
                }
            }
        }
        return null;
    }

    private Duration timeout() {
        return Duration.ofMillis(Math.max(1L, properties.getTimeoutMs()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
