package org.clustertest.registry;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.clustertest.core.ConfigurationException;
import org.clustertest.core.RegistrationException;
import org.clustertest.core.RegressionTest;
import org.clustertest.core.SkipTestException;
import org.clustertest.core.TestClass;
import org.clustertest.core.TestConstruction;
import org.clustertest.fixture.InstanceFactory;
import org.clustertest.obs.JsonLinesLogger;
import org.clustertest.obs.LogContext;
import org.clustertest.obs.LogLevel;

/**
 * Constructs test instances, isolating failures of single instances.
 *
 * <p>Skip requests and construction failures drop the instance and are logged. Configuration and
 * registration errors mean the test itself is broken and are propagated.
 */
final class TestInstantiator implements InstanceFactory {
    static final String VERBOSE_HINT = "(rerun with verbose logging for more information)";

    private final JsonLinesLogger logger;
    private final String operation;

    TestInstantiator(JsonLinesLogger logger, String operation) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.operation = Objects.requireNonNull(operation, "operation");
    }

    @Override
    public Optional<RegressionTest> create(TestClass<?> testClass, TestConstruction construction) {
        LogContext context = LogContext.builder(TestRegistry.COMPONENT, operation)
            .testName(construction.name().orElse(testClass.nestedName()))
            .variant(construction.variantNum().orElse(null))
            .build();
        try {
            return Optional.of(testClass.instantiate(construction));
        } catch (SkipTestException e) {
            logger.warning("skipping test '" + testClass.nestedName() + "': " + e.getMessage(), context);
            return Optional.empty();
        } catch (ConfigurationException | RegistrationException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warning(
                "skipping test '" + testClass.nestedName() + "': " + summarize(e) + " " + VERBOSE_HINT,
                context,
                Map.of("exception", e.getClass().getName())
            );
            if (logger.isEnabled(LogLevel.VERBOSE)) {
                logger.verbose("construction failure traceback", context, Map.of("traceback", stackTrace(e)));
            }
            return Optional.empty();
        }
    }

    private static String summarize(RuntimeException exception) {
        String message = exception.getMessage();
        String type = exception.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    private static String stackTrace(Throwable throwable) {
        StringWriter buffer = new StringWriter();
        try (PrintWriter writer = new PrintWriter(buffer)) {
            throwable.printStackTrace(writer);
        }
        return buffer.toString();
    }
}
