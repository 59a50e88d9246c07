package com.linlay.carassist.storage;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class Rows {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Rows() {
    }

    public static Map<String, Object> normalize(Map<String, Object> raw) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (raw == null) {
            return row;
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            row.put(entry.getKey().toLowerCase(Locale.ROOT), normalizeValue(entry.getValue()));
        }
        return row;
    }

    public static Long longValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return integral(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? integral(BigDecimal.valueOf(number)) : null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    // fractional values are rejected, never truncated
    private static Long integral(BigDecimal decimal) {
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException ex) {
            return null;
        }
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Timestamp timestamp) {
            return TIMESTAMP_FORMAT.format(timestamp.toLocalDateTime());
        }
        if (value instanceof LocalDateTime dateTime) {
            return TIMESTAMP_FORMAT.format(dateTime);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return TIMESTAMP_FORMAT.format(dateTime.toLocalDateTime());
        }
        return value;
    }
}
