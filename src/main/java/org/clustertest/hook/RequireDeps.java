package org.clustertest.hook;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a hook whose {@link DependencyLookup} parameters are bound to the test's dependencies.
 *
 * <p>Each parameter names a dependency, either through {@link DependencyName} or through its
 * compiled parameter name. Unless the method is also attached with {@link RunBefore} or
 * {@link RunAfter}, it runs after setup, ahead of every other post-setup hook.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RequireDeps {
}
