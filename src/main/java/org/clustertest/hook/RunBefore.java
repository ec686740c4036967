package org.clustertest.hook;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Attaches a test method to run just before a pipeline stage. Repeat the annotation to attach
 * the method to several stages. {@link Stage#INIT} is rejected.
 *
 * <p>Only methods of the test class and its superclasses are collected, not default methods of
 * the interfaces it implements.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(RunBefore.List.class)
public @interface RunBefore {
    Stage value();

    @Documented
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        RunBefore[] value();
    }
}
