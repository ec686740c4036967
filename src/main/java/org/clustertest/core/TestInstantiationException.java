package org.clustertest.core;

/**
 * Wraps a checked exception thrown while constructing a test instance.
 */
public final class TestInstantiationException extends RuntimeException {
    public TestInstantiationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
