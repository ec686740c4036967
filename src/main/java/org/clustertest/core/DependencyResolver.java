package org.clustertest.core;

/**
 * Resolves the instance a test depends on once the dependency graph has been built.
 */
@FunctionalInterface
public interface DependencyResolver {
    RegressionTest getDependency(RegressionTest requester, String target, String environ);
}
