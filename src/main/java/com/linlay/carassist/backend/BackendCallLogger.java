package com.linlay.carassist.backend;

import com.linlay.carassist.config.ChatBackendProperties;
import org.slf4j.Logger;

import java.util.UUID;

public class BackendCallLogger {

    private static final int PREVIEW_LIMIT = 300;

    private final boolean enabled;
    private final boolean maskSensitive;

    public BackendCallLogger() {
        this.enabled = true;
        this.maskSensitive = true;
    }

    public BackendCallLogger(ChatBackendProperties.InteractionLog properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
    }

    String generateTraceId() {
        return "ava-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    String preview(String text) {
        String safe = BackendLogSanitizer.maskText(text == null ? "" : text, maskSensitive);
        if (safe.length() <= PREVIEW_LIMIT) {
            return safe;
        }
        return safe.substring(0, PREVIEW_LIMIT) + "...";
    }

    static String shortId(String id) {
        if (id == null) {
            return "-";
        }
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    void debug(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.debug(pattern, arguments);
        }
    }

    void warn(Logger logger, String pattern, Object... arguments) {
        logger.warn(pattern, arguments);
    }
}
