package org.clustertest.fixture;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.clustertest.core.RegressionTest;

/**
 * Declares a fixture of a test class or of a fixture mixin interface.
 *
 * <p>Mixin interfaces carry fixtures only. Hook annotations on their default methods are not
 * collected; hooks are inherited along the superclass chain.
 *
 * <pre>{@code
 * @Fixture(name = "build", test = BuildToolchain.class, scope = FixtureScope.ENVIRONMENT)
 * public class StreamBenchmark extends RunOnlyRegressionTest { ... }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Repeatable(Fixture.List.class)
public @interface Fixture {
    String name();

    Class<? extends RegressionTest> test();

    FixtureScope scope() default FixtureScope.TEST;

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    @interface List {
        Fixture[] value();
    }
}
