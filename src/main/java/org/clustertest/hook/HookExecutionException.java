package org.clustertest.hook;

/**
 * A hook method failed with a checked exception or could not be invoked.
 */
public final class HookExecutionException extends RuntimeException {
    private final String hookName;

    public HookExecutionException(String hookName, String message, Throwable cause) {
        super(message, cause);
        this.hookName = hookName;
    }

    public String hookName() {
        return hookName;
    }
}
