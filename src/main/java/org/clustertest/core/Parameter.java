package org.clustertest.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares one dimension of a test's parameter space. Every combination of parameter values
 * becomes a separate test variant.
 *
 * <p>A parameter declared without values leaves the test abstract; a subclass must redeclare it
 * with values before the test can be registered.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Repeatable(Parameter.List.class)
public @interface Parameter {
    String name();

    String[] values() default {};

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    @interface List {
        Parameter[] value();
    }
}
