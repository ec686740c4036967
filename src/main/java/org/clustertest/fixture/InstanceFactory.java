package org.clustertest.fixture;

import java.util.Optional;
import org.clustertest.core.RegressionTest;
import org.clustertest.core.TestClass;
import org.clustertest.core.TestConstruction;

/**
 * Constructs test instances, returning empty when the instance was dropped.
 */
@FunctionalInterface
public interface InstanceFactory {
    Optional<RegressionTest> create(TestClass<?> testClass, TestConstruction construction);

    /**
     * Factory that constructs every instance and lets failures propagate.
     */
    static InstanceFactory direct() {
        return (testClass, construction) -> Optional.of(testClass.instantiate(construction));
    }
}
