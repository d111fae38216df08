package org.opwire.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(String level, String message, CorrelationContext correlationContext, Map<String, ?> fields);

    /**
     * Lets callers skip building field maps for events that would be dropped.
     */
    default boolean isEnabled(String level) {
        return true;
    }

    default void debug(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        if (isEnabled("DEBUG")) {
            log("DEBUG", message, correlationContext, fields);
        }
    }

    default void info(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log("INFO", message, correlationContext, fields);
    }

    default void info(String message, CorrelationContext correlationContext) {
        info(message, correlationContext, Collections.emptyMap());
    }

    default void error(String message, CorrelationContext correlationContext, Map<String, ?> fields) {
        log("ERROR", message, correlationContext, fields);
    }

    static JsonLinesLogger discarding() {
        return DiscardingJsonLinesLogger.INSTANCE;
    }

    @Override
    void close();
}
