package org.clustertest.core;

/**
 * Raised from a test constructor or post-init hook to drop the instance without failing the run.
 */
public class SkipTestException extends RuntimeException {
    public SkipTestException(final String message) {
        super(message);
    }
}
