package org.clustertest.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * JSON-lines logger intended for deterministic diagnostics.
 *
 * <p>Events below the configured threshold are dropped before encoding.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final LogLevel threshold;
    private final boolean autoFlush;
    private final boolean ownsWriter;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(outputStream, Clock.systemUTC(), LogLevel.INFO, true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, LogLevel threshold, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, threshold, autoFlush, true);
    }

    public StructuredJsonLinesLogger(
        Writer writer,
        Clock clock,
        LogLevel threshold,
        boolean autoFlush,
        boolean ownsWriter
    ) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.autoFlush = autoFlush;
        this.ownsWriter = ownsWriter;
        this.closed = false;
    }

    /**
     * Logger writing to {@code System.err}; closing it flushes but leaves the stream open.
     */
    public static StructuredJsonLinesLogger standardError(LogLevel threshold) {
        return new StructuredJsonLinesLogger(
            new OutputStreamWriter(System.err, StandardCharsets.UTF_8),
            Clock.systemUTC(),
            threshold,
            true,
            false
        );
    }

    public LogLevel threshold() {
        return threshold;
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return level != null && level.isEnabledAt(threshold);
    }

    @Override
    public synchronized void log(
        LogLevel level,
        String message,
        LogContext context,
        Map<String, ?> fields
    ) {
        ensureOpen();
        LogLevel safeLevel = level == null ? LogLevel.INFO : level;
        if (!isEnabled(safeLevel)) {
            return;
        }
        String safeMessage = message == null ? "" : message;
        LogContext safeContext = Objects.requireNonNull(context, "context");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", safeLevel.name());
        event.put("message", safeMessage);
        event.putAll(safeContext.asFields());
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || event.containsKey(key)) {
                continue;
            }
            event.put(key, entry.getValue());
        }

        writeLine(JsonEncoder.encode(event));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            if (ownsWriter) {
                writer.close();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    static final class JsonEncoder {
        private JsonEncoder() {
        }

        static String encode(Object value) {
            StringBuilder sb = new StringBuilder();
            appendValue(sb, value);
            return sb.toString();
        }

        @SuppressWarnings("unchecked")
        private static void appendValue(StringBuilder sb, Object value) {
            if (value == null) {
                sb.append("null");
                return;
            }
            if (value instanceof String s) {
                appendString(sb, s);
                return;
            }
            if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
                return;
            }
            if (value instanceof Enum<?> e) {
                appendString(sb, e.name());
                return;
            }
            if (value instanceof Map<?, ?> map) {
                appendObject(sb, (Map<Object, Object>) map);
                return;
            }
            if (value instanceof Collection<?> collection) {
                appendArray(sb, collection);
                return;
            }
            if (value.getClass().isArray()) {
                int length = Array.getLength(value);
                List<Object> boxed = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    boxed.add(Array.get(value, i));
                }
                appendArray(sb, boxed);
                return;
            }
            appendString(sb, String.valueOf(value));
        }

        private static void appendObject(StringBuilder sb, Map<Object, Object> map) {
            sb.append('{');
            boolean first = true;
            Map<String, Object> normalized = normalizeKeyMap(map);
            for (String key : new TreeSet<>(normalized.keySet())) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendString(sb, key);
                sb.append(':');
                appendValue(sb, normalized.get(key));
            }
            sb.append('}');
        }

        private static void appendArray(StringBuilder sb, Collection<?> list) {
            sb.append('[');
            boolean first = true;
            for (Object item : list) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendValue(sb, item);
            }
            sb.append(']');
        }

        private static void appendString(StringBuilder sb, String value) {
            sb.append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\b' -> sb.append("\\b");
                    case '\f' -> sb.append("\\f");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> {
                        if (c <= 0x1F) {
                            sb.append(String.format("\\u%04x", (int) c));
                        } else {
                            sb.append(c);
                        }
                    }
                }
            }
            sb.append('"');
        }

        private static Map<String, Object> normalizeKeyMap(Map<Object, Object> source) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<Object, Object> entry : source.entrySet()) {
                normalized.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return normalized;
        }
    }
}
