package org.clustertest.runtime;

import java.util.Objects;

/**
 * Runtime collaborator exposing the topology of the current system.
 */
@FunctionalInterface
public interface TestRuntime {
    SystemTopology system();

    static TestRuntime of(SystemTopology system) {
        Objects.requireNonNull(system, "system");
        return () -> system;
    }
}
