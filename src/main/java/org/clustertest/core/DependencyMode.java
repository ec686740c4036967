package org.clustertest.core;

/**
 * Granularity at which a dependency edge binds the dependent test to its target.
 */
public enum DependencyMode {
    /** Every partition and environment of the dependent binds to the single target case. */
    FULLY,
    /** Cases bind to the target case running on the same partition. */
    BY_PARTITION,
    /** Cases bind to the target case with the same partition and environment. */
    BY_ENVIRONMENT,
    /** Each case binds to the identical target case. */
    BY_CASE
}
