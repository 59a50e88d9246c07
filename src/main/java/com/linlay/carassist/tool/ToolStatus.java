package com.linlay.carassist.tool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ToolStatus {
    SUCCESS,
    ERROR,
    UNSURE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
