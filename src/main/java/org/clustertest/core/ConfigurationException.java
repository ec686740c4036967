package org.clustertest.core;

/**
 * A test instance is structurally unusable, for example its valid systems are undefined or a
 * fixture index is out of range. Never swallowed by the instantiation loop.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(final String message) {
        super(message);
    }
}
