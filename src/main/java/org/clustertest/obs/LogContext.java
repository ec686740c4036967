package org.clustertest.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Context metadata emitted with every structured log event.
 */
public final class LogContext {
    private final String component;
    private final String operation;
    private final String testName;
    private final Integer variant;

    private LogContext(Builder builder) {
        this.component = requireText(builder.component, "component");
        this.operation = requireText(builder.operation, "operation");
        this.testName = normalize(builder.testName);
        this.variant = builder.variant;
    }

    public static LogContext of(String component, String operation) {
        return builder(component, operation).build();
    }

    public static Builder builder(String component, String operation) {
        return new Builder(component, operation);
    }

    public String component() {
        return component;
    }

    public String operation() {
        return operation;
    }

    public Optional<String> testName() {
        return Optional.ofNullable(testName);
    }

    public Optional<Integer> variant() {
        return Optional.ofNullable(variant);
    }

    public LogContext withTest(String testName) {
        Builder builder = builder(component, operation).testName(testName);
        builder.variant(variant);
        return builder.build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("component", component);
        fields.put("operation", operation);
        if (testName != null) {
            fields.put("test", testName);
        }
        if (variant != null) {
            fields.put("variant", variant);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String component;
        private final String operation;
        private String testName;
        private Integer variant;

        private Builder(String component, String operation) {
            this.component = Objects.requireNonNull(component, "component");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder testName(String testName) {
            this.testName = testName;
            return this;
        }

        public Builder variant(Integer variant) {
            this.variant = variant;
            return this;
        }

        public LogContext build() {
            return new LogContext(this);
        }
    }
}
