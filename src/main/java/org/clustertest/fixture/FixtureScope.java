package org.clustertest.fixture;

import org.clustertest.core.DependencyMode;

/**
 * Sharing level of a fixture instance.
 */
public enum FixtureScope {
    /** One instance for the whole run, on the first partition and environment. */
    SESSION(DependencyMode.FULLY),
    /** One instance per partition. */
    PARTITION(DependencyMode.BY_PARTITION),
    /** One instance per partition and environment pair. */
    ENVIRONMENT(DependencyMode.BY_ENVIRONMENT),
    /** A private instance for every requesting test. */
    TEST(DependencyMode.BY_CASE);

    private final DependencyMode dependencyMode;

    FixtureScope(DependencyMode dependencyMode) {
        this.dependencyMode = dependencyMode;
    }

    /**
     * Mode of the dependency edge from the requesting test to the fixture.
     */
    public DependencyMode dependencyMode() {
        return dependencyMode;
    }

    public boolean requiresRunOnly() {
        return this == SESSION || this == PARTITION;
    }
}
