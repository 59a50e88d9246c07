package com.linlay.carassist.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InitSessionResponse(
        @JsonProperty("session_id")
        String sessionId
) {
}
