package com.linlay.carassist.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns backend text into plain user-facing prose. Used for both direct answers and phrased
 * tool results.
 * <p>
 * Whether a JSON object is conversational is decided by value types alone: any nested array or
 * object disqualifies it. Short structured answers can be misjudged by this.
 */
@Component
public class ResponseNormalizer {

    public static final String FORMAT_FALLBACK =
            "I have the information, but I need to format it better. Could you ask again?";

    static final List<String> TEXT_KEYS = List.of(
            "message", "response", "answer", "text", "content", "reply", "output", "result"
    );
    private static final int MAX_STRING_LAYERS = 2;

    // a document only counts as structured when the whole text is one JSON value
    private final ObjectReader treeReader;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.treeReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String text = stripFences(raw.trim());
        for (int layer = 0; layer <= MAX_STRING_LAYERS; layer++) {
            JsonNode node = parse(text);
            if (node == null) {
                return text;
            }
            if (node.isTextual()) {
                if (layer == MAX_STRING_LAYERS) {
                    return node.asText().trim();
                }
                text = stripFences(node.asText().trim());
                continue;
            }
            if (node.isObject()) {
                return fromObject(node, text);
            }
            return text;
        }
        return text;
    }

    private String fromObject(JsonNode node, String original) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isContainerNode()) {
                return FORMAT_FALLBACK;
            }
        }
        for (String key : TEXT_KEYS) {
            JsonNode value = node.get(key);
            if (value != null && value.isTextual()) {
                return value.asText().trim();
            }
        }
        if (node.size() == 1) {
            JsonNode only = node.elements().next();
            if (only.isTextual()) {
                return only.asText().trim();
            }
        }
        return original;
    }

    private JsonNode parse(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return treeReader.readTree(text);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    static String stripFences(String text) {
        String stripped = text;
        if (stripped.startsWith("```")) {
            stripped = stripped.substring(3);
            if (stripped.regionMatches(true, 0, "json", 0, 4)) {
                stripped = stripped.substring(4);
            }
            stripped = stripped.trim();
        }
        if (stripped.endsWith("```")) {
            stripped = stripped.substring(0, stripped.length() - 3).trim();
        }
        return stripped;
    }
}
