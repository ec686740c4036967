package org.clustertest.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.clustertest.config.FrameworkConfig;
import org.clustertest.core.RegistrationException;
import org.clustertest.core.RegressionTest;
import org.clustertest.core.TestClass;
import org.clustertest.obs.JsonLinesLogger;
import org.clustertest.obs.LogContext;
import org.clustertest.version.Version;
import org.clustertest.version.VersionValidator;

/**
 * Validates test classes and registers their constructions into a {@link TestRegistry}.
 *
 * <p>Abstract tests and tests whose {@link RequiredVersion} excludes the running framework version
 * are skipped with a warning rather than rejected.
 */
public final class TestRegistrar {
    private final FrameworkConfig config;
    private final JsonLinesLogger logger;

    public TestRegistrar(FrameworkConfig config, JsonLinesLogger logger) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Registers every variant of {@code type}.
     *
     * @return true when the test was registered
     * @throws RegistrationException when {@code type} is not a regression test
     */
    public boolean registerSimpleTest(TestRegistry registry, Class<?> type) {
        Objects.requireNonNull(registry, "registry");
        TestClass<?> testClass = requireTest(type);
        if (!isValid(testClass)) {
            return false;
        }
        int numVariants = testClass.numVariants();
        for (int variant = 0; variant < numVariants; variant++) {
            registry.add(TestRecipe.of(testClass, variant));
        }
        return true;
    }

    /**
     * Registers one construction per argument map, without variant selection.
     */
    public boolean registerParameterizedTest(TestRegistry registry, Class<?> type, List<? extends Map<String, ?>> argumentSets) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(argumentSets, "argumentSets");
        TestClass<?> testClass = requireTest(type);
        if (!isValid(testClass)) {
            return false;
        }
        for (Map<String, ?> arguments : argumentSets) {
            registry.add(testClass, null, Objects.requireNonNull(arguments, "arguments"));
        }
        return true;
    }

    /**
     * Skips every construction of {@code type} in {@code registry} unless one of the version
     * expressions matches the running framework version.
     *
     * @return true when the test stays registered
     */
    public boolean applyRequiredVersion(TestRegistry registry, Class<?> type, String... conditions) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(conditions, "conditions");
        if (conditions.length == 0) {
            throw new IllegalArgumentException("no versions specified");
        }
        TestClass<?> testClass = requireTest(type);
        if (isCompatible(List.of(conditions))) {
            return true;
        }
        registry.skip(testClass);
        return false;
    }

    private boolean isValid(TestClass<?> testClass) {
        LogContext context = LogContext.builder(TestRegistry.COMPONENT, "register").testName(testClass.nestedName()).build();
        if (testClass.isAbstract()) {
            logger.warning(
                "skipping test '" + testClass.nestedName() + "': test has one or more undefined parameters",
                context
            );
            return false;
        }
        RequiredVersion required = testClass.javaClass().getAnnotation(RequiredVersion.class);
        if (required != null && !isCompatible(List.of(required.value()))) {
            Version version = config.frameworkVersion();
            logger.warning(
                "skipping incompatible test '" + testClass.nestedName() + "': not valid for framework version "
                    + version.major() + "." + version.minor() + "." + version.patch(),
                context
            );
            return false;
        }
        return true;
    }

    private boolean isCompatible(List<String> expressions) {
        if (expressions.isEmpty()) {
            return true;
        }
        List<VersionValidator> conditions = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            conditions.add(new VersionValidator(expression));
        }
        for (VersionValidator condition : conditions) {
            if (condition.validate(config.frameworkVersion())) {
                return true;
            }
        }
        return false;
    }

    private static TestClass<?> requireTest(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (!RegressionTest.class.isAssignableFrom(type)) {
            throw new RegistrationException("the registered class must be a subclass of RegressionTest");
        }
        return TestClass.forType(type);
    }
}
