package com.linlay.carassist.plan;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class PlanParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    static final int MAX_SCAN_CHARS = 64 * 1024;

    private final ObjectMapper objectMapper;

    public PlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<Map<String, Object>> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String fenced = fencedBlock(raw);
        if (fenced != null) {
            Optional<Map<String, Object>> parsed = readObject(firstBalancedObject(fenced));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return readObject(firstBalancedObject(raw));
    }

    private Optional<Map<String, Object>> readObject(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.convertValue(node, MAP_TYPE));
        } catch (Exception ex) {
            return Optional.empty();
        }
    }

    static String fencedBlock(String raw) {
        int start = raw.toLowerCase(Locale.ROOT).indexOf(JSON_FENCE);
        if (start < 0) {
            return null;
        }
        int bodyStart = start + JSON_FENCE.length();
        int end = raw.indexOf(FENCE, bodyStart);
        return end < 0 ? raw.substring(bodyStart) : raw.substring(bodyStart, end);
    }

    static String firstBalancedObject(String text) {
        int limit = Math.min(text.length(), MAX_SCAN_CHARS);
        int start = text.indexOf('{');
        while (start >= 0 && start < limit) {
            int end = matchingBrace(text, start, limit);
            if (end > 0) {
                return text.substring(start, end + 1);
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private static int matchingBrace(String text, int start, int limit) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < limit; i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
