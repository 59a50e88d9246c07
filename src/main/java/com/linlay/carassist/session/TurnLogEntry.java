package com.linlay.carassist.session;

import java.time.Instant;

public record TurnLogEntry(
        String event,
        String detail,
        Instant timestamp
) {
}
