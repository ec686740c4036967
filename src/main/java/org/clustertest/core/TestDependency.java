package org.clustertest.core;

import java.util.Objects;

/**
 * Dependency edge recorded on a test instance.
 */
public record TestDependency(String target, DependencyMode mode) {
    public TestDependency {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(mode, "mode");
        if (target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
    }
}
