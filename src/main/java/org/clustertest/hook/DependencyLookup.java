package org.clustertest.hook;

import org.clustertest.core.RegressionTest;

/**
 * Lookup of one named dependency, partially applied to the requesting test.
 */
@FunctionalInterface
public interface DependencyLookup {
    RegressionTest resolve(String environ);
}
