package org.clustertest.core;

/**
 * Structural error in a test class declaration: invalid fixture scope, conflicting or shadowed
 * fixture names, invalid hook attachment, or an attempt to construct an abstract test.
 */
public class RegistrationException extends RuntimeException {
    public RegistrationException(final String message) {
        super(message);
    }

    public RegistrationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
