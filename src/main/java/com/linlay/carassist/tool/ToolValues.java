package com.linlay.carassist.tool;

import com.linlay.carassist.storage.Rows;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

final class ToolValues {

    private ToolValues() {
    }

    static String dateTime(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime dateTime) {
            return Rows.TIMESTAMP_FORMAT.format(dateTime);
        }
        String text = String.valueOf(value).trim().replace('T', ' ');
        if (text.endsWith("Z")) {
            text = text.substring(0, text.length() - 1);
        }
        String candidate = text;
        int fraction = candidate.indexOf('.');
        if (fraction > 0) {
            candidate = candidate.substring(0, fraction);
        }
        LocalDateTime parsed = parseLocal(candidate);
        if (parsed == null) {
            parsed = parseOffset(text);
        }
        if (parsed == null && candidate.length() == 10) {
            parsed = parseLocal(candidate + " 00:00:00");
        }
        return parsed == null ? text : Rows.TIMESTAMP_FORMAT.format(parsed);
    }

    private static LocalDateTime parseLocal(String text) {
        try {
            return LocalDateTime.parse(text.replace(' ', 'T'));
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static LocalDateTime parseOffset(String text) {
        try {
            return OffsetDateTime.parse(text.replace(' ', 'T')).toLocalDateTime();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    static Map<String, Object> onlyColumns(Map<String, Object> args, Set<String> allowed) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            if (allowed.contains(entry.getKey()) && entry.getValue() != null) {
                sanitized.put(entry.getKey(), entry.getValue());
            }
        }
        return sanitized;
    }

    static boolean hasText(Object value) {
        return value != null && StringUtils.hasText(String.valueOf(value));
    }

    static Map<String, Object> received(Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("received", value);
        return data;
    }
}
