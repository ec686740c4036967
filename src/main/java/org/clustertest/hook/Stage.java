package org.clustertest.hook;

import java.util.Locale;

/**
 * Pipeline stages that user hooks can be attached to.
 *
 * <p>Pre-stage hooks run before the function that starts a stage and post-stage hooks after the
 * function that completes it, so compile and run hooks bracket both the submission and the wait.
 */
public enum Stage {
    INIT(null, "init"),
    SETUP("setup", "setup"),
    COMPILE("compile", "compile_wait"),
    RUN("run", "run_wait"),
    SANITY("sanity", "sanity"),
    PERFORMANCE("performance", "performance"),
    CLEANUP("cleanup", "cleanup");

    private final String startFunction;
    private final String endFunction;

    Stage(String startFunction, String endFunction) {
        this.startFunction = startFunction;
        this.endFunction = endFunction;
    }

    public boolean acceptsPreHooks() {
        return startFunction != null;
    }

    public String prePhase() {
        if (startFunction == null) {
            throw new IllegalStateException("pre-" + name().toLowerCase(Locale.ROOT) + " hooks are not allowed");
        }
        return HookRegistry.PRE_PREFIX + startFunction;
    }

    public String postPhase() {
        return HookRegistry.POST_PREFIX + endFunction;
    }

    public static Stage parse(String rawValue) {
        String normalized = rawValue == null ? "" : rawValue.trim().toUpperCase(Locale.ROOT);
        for (Stage stage : values()) {
            if (stage.name().equals(normalized)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("invalid pipeline stage specified: '" + rawValue + "'");
    }
}
