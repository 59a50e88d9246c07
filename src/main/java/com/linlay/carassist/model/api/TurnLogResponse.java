package com.linlay.carassist.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linlay.carassist.session.TurnLogEntry;

import java.util.List;

public record TurnLogResponse(
        @JsonProperty("session_id")
        String sessionId,
        List<TurnLogEntry> logs
) {
}
