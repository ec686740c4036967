package org.clustertest.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.clustertest.runtime.TestRuntime;

/**
 * Per-construction configuration handed to a test constructor.
 *
 * <p>Fixture instances receive their scoped name, partitions and environments here rather than
 * through shared class state, so two fixtures of the same class can be constructed concurrently.
 */
public final class TestConstruction {
    private final String name;
    private final List<String> validSystems;
    private final List<String> validProgEnvirons;
    private final Integer variantNum;
    private final Set<SysEnvReset> reset;
    private final Map<String, Object> arguments;
    private final TestRuntime runtime;
    private final boolean scoped;

    private TestConstruction(Builder builder) {
        this.name = normalize(builder.name);
        this.validSystems = builder.validSystems == null ? null : List.copyOf(builder.validSystems);
        this.validProgEnvirons = builder.validProgEnvirons == null ? null : List.copyOf(builder.validProgEnvirons);
        this.variantNum = builder.variantNum;
        this.reset = builder.reset.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(builder.reset));
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
        this.runtime = builder.runtime;
        this.scoped = builder.scoped;
        if (variantNum != null && variantNum < 0) {
            throw new IllegalArgumentException("variantNum must be >= 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TestConstruction variant(int variantNum) {
        return builder().variantNum(variantNum).build();
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    /**
     * Valid systems to start from, or empty when undefined.
     */
    public Optional<List<String>> validSystems() {
        return Optional.ofNullable(validSystems);
    }

    public Optional<List<String>> validProgEnvirons() {
        return Optional.ofNullable(validProgEnvirons);
    }

    public Optional<Integer> variantNum() {
        return Optional.ofNullable(variantNum);
    }

    public Set<SysEnvReset> reset() {
        return reset;
    }

    public Map<String, Object> arguments() {
        return arguments;
    }

    public Optional<TestRuntime> runtime() {
        return Optional.ofNullable(runtime);
    }

    /**
     * True when name, systems and environments were assigned by a fixture scope and must survive
     * the constructor unchanged.
     */
    public boolean scoped() {
        return scoped;
    }

    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .validSystems(validSystems)
            .validProgEnvirons(validProgEnvirons)
            .variantNum(variantNum)
            .reset(reset)
            .arguments(arguments)
            .runtime(runtime)
            .scoped(scoped);
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private String name;
        private List<String> validSystems;
        private List<String> validProgEnvirons;
        private Integer variantNum;
        private Set<SysEnvReset> reset = EnumSet.noneOf(SysEnvReset.class);
        private final Map<String, Object> arguments = new LinkedHashMap<>();
        private TestRuntime runtime;
        private boolean scoped;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder validSystems(List<String> validSystems) {
            this.validSystems = validSystems;
            return this;
        }

        public Builder validProgEnvirons(List<String> validProgEnvirons) {
            this.validProgEnvirons = validProgEnvirons;
            return this;
        }

        public Builder variantNum(Integer variantNum) {
            this.variantNum = variantNum;
            return this;
        }

        public Builder reset(Set<SysEnvReset> reset) {
            Objects.requireNonNull(reset, "reset");
            this.reset = reset.isEmpty() ? EnumSet.noneOf(SysEnvReset.class) : EnumSet.copyOf(reset);
            return this;
        }

        public Builder arguments(Map<String, ?> arguments) {
            Objects.requireNonNull(arguments, "arguments");
            this.arguments.clear();
            for (Map.Entry<String, ?> entry : arguments.entrySet()) {
                argument(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder argument(String key, Object value) {
            Objects.requireNonNull(key, "argument key");
            this.arguments.put(key, value);
            return this;
        }

        public Builder runtime(TestRuntime runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder scoped(boolean scoped) {
            this.scoped = scoped;
            return this;
        }

        public TestConstruction build() {
            return new TestConstruction(this);
        }
    }
}
