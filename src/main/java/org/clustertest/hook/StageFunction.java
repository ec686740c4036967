package org.clustertest.hook;

import org.clustertest.core.RegressionTest;

/**
 * Body of a pipeline stage executed on a test instance.
 */
@FunctionalInterface
public interface StageFunction {
    void run(RegressionTest test);
}
