package org.clustertest.registry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Framework versions a test is compatible with. Each entry is a version expression accepted by
 * {@link org.clustertest.version.VersionValidator}; the test is registered when any of them
 * matches the running framework version.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface RequiredVersion {
    String[] value();
}
