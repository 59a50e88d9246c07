package com.linlay.carassist.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record InitSessionRequest(
        @NotBlank
        @JsonProperty("lead_id")
        String leadId,
        @NotBlank
        @JsonProperty("buyer_id")
        String buyerId,
        @NotBlank
        @JsonProperty("escalation_phone")
        String escalationPhone
) {
}
