package com.linlay.carassist.tool;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        ToolStatus status,
        ErrorCode code,
        String message,
        Map<String, Object> data
) {

    public ToolResult {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        message = message == null ? "" : message;
    }

    public static ToolResult success(String message, Map<String, Object> data) {
        return new ToolResult(ToolStatus.SUCCESS, null, message, data);
    }

    public static ToolResult error(ErrorCode code, String message) {
        return new ToolResult(ToolStatus.ERROR, code, message, Map.of());
    }

    public static ToolResult error(ErrorCode code, String message, Map<String, Object> data) {
        return new ToolResult(ToolStatus.ERROR, code, message, data);
    }

    public static ToolResult unsure(ErrorCode code, String message, Map<String, Object> data) {
        return new ToolResult(ToolStatus.UNSURE, code, message, data);
    }

    public boolean isSuccess() {
        return status == ToolStatus.SUCCESS;
    }

    public boolean hasCode(ErrorCode expected) {
        return code == expected;
    }
}
