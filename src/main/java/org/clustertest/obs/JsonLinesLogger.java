package org.clustertest.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(LogLevel level, String message, LogContext context, Map<String, ?> fields);

    boolean isEnabled(LogLevel level);

    default void log(LogLevel level, String message, LogContext context) {
        log(level, message, context, Collections.emptyMap());
    }

    default void info(String message, LogContext context, Map<String, ?> fields) {
        log(LogLevel.INFO, message, context, fields);
    }

    default void info(String message, LogContext context) {
        info(message, context, Collections.emptyMap());
    }

    default void warning(String message, LogContext context, Map<String, ?> fields) {
        log(LogLevel.WARNING, message, context, fields);
    }

    default void warning(String message, LogContext context) {
        warning(message, context, Collections.emptyMap());
    }

    default void verbose(String message, LogContext context, Map<String, ?> fields) {
        log(LogLevel.VERBOSE, message, context, fields);
    }

    default void error(String message, LogContext context, Map<String, ?> fields) {
        log(LogLevel.ERROR, message, context, fields);
    }

    default void error(String message, LogContext context) {
        error(message, context, Collections.emptyMap());
    }

    @Override
    void close();
}
