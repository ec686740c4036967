package org.clustertest.hook;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Attaches a test method to run just after a pipeline stage. A post-init hook runs right after
 * the test constructor, before fixtures are injected.
 *
 * <p>Only methods of the test class and its superclasses are collected, not default methods of
 * the interfaces it implements.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(RunAfter.List.class)
public @interface RunAfter {
    Stage value();

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        RunAfter[] value();
    }
}
