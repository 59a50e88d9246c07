package com.linlay.carassist.session;

public record SessionContext(
        String sessionId,
        Object leadId,
        Object buyerId,
        String escalationPhone,
        String storageDescriptor
) {

    public static Object coerceId(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException ignored) {
                return trimmed;
            }
        }
        return trimmed;
    }

    public String shortId() {
        if (sessionId == null) {
            return "-";
        }
        return sessionId.length() <= 8 ? sessionId : sessionId.substring(0, 8);
    }
}
