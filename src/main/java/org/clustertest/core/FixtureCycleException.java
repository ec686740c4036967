package org.clustertest.core;

import java.util.List;

/**
 * Thrown when fixture declarations form a cycle.
 */
public final class FixtureCycleException extends ConfigurationException {
    private final List<String> cycle;

    public FixtureCycleException(final List<String> cycle) {
        super("cyclic fixture dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Test class names along the cycle; the first and last entries are the same class.
     */
    public List<String> cycle() {
        return cycle;
    }
}
