package org.clustertest.runtime;

/**
 * Programming environment available on a system partition.
 */
public record ProgEnvironment(String name) {
    public ProgEnvironment {
        name = TopologyText.requireText(name, "environment name");
    }
}
