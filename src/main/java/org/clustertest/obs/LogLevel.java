package org.clustertest.obs;

import java.util.Locale;

/**
 * Severity of a structured log event, most severe first.
 */
public enum LogLevel {
    ERROR(40),
    WARNING(30),
    INFO(20),
    VERBOSE(15),
    DEBUG(10);

    private final int severity;

    LogLevel(final int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public boolean isEnabledAt(final LogLevel threshold) {
        return severity >= threshold.severity;
    }

    public static LogLevel parse(final String rawValue) {
        final String normalized = rawValue == null ? "" : rawValue.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return INFO;
        }
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        for (final LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("unsupported log level: " + rawValue);
    }
}
