package com.linlay.carassist.geo;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SearchLayer {
    IN_STATE,
    NEIGHBOR,
    NATIONAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
