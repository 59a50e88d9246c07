package com.linlay.carassist.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatRequest(
        @JsonProperty("session_id")
        String sessionId,
        String message
) {
}
