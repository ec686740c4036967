package org.clustertest.version;

/**
 * Thrown when a version string or a version compatibility expression is malformed.
 */
public final class VersionFormatException extends IllegalArgumentException {
    private final String input;

    public VersionFormatException(final String input, final String message) {
        super(message);
        this.input = input;
    }

    /**
     * Raw text that failed to parse, possibly null.
     */
    public String input() {
        return input;
    }
}
