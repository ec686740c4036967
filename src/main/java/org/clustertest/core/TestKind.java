package org.clustertest.core;

/**
 * Pipeline capabilities of a test class.
 */
public enum TestKind {
    REGRESSION(true, true),
    RUN_ONLY(false, true),
    COMPILE_ONLY(true, false);

    private final boolean compiles;
    private final boolean runs;

    TestKind(final boolean compiles, final boolean runs) {
        this.compiles = compiles;
        this.runs = runs;
    }

    public boolean compiles() {
        return compiles;
    }

    public boolean runs() {
        return runs;
    }

    static TestKind of(final Class<?> testClass) {
        if (RunOnlyRegressionTest.class.isAssignableFrom(testClass)) {
            return RUN_ONLY;
        }
        if (CompileOnlyRegressionTest.class.isAssignableFrom(testClass)) {
            return COMPILE_ONLY;
        }
        return REGRESSION;
    }
}
