package com.linlay.carassist.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;

/**
 * Accumulates the frames of one reply stream. JSON frames contribute their {@code text}; other
 * frames are appended verbatim.
 */
class StreamCollector {

    static final String END_MARKER = "<<END_OF_RESPONSE>>";

    private final ObjectMapper objectMapper;
    private final StringBuilder text = new StringBuilder();
    private boolean badRequest;

    StreamCollector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Consumes one frame and reports whether the stream is finished.
     */
    boolean accept(String frame) {
        if (frame == null || frame.isEmpty()) {
            return true;
        }
        if (frame.strip().toLowerCase(Locale.ROOT).startsWith("bad request")) {
            badRequest = true;
            return true;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(frame);
        } catch (Exception ex) {
            text.append(frame);
            return false;
        }
        if (node == null || !node.isObject()) {
            return false;
        }
        if (END_MARKER.equals(node.path("response").asText(null))) {
            return true;
        }
        JsonNode chunk = node.get("text");
        if (chunk != null && !chunk.isNull()) {
            text.append(chunk.isTextual() ? chunk.asText() : chunk.toString());
        }
        return false;
    }

    SendOutcome outcome() {
        return new SendOutcome(text.toString().strip(), badRequest);
    }
}
