package org.clustertest.fixture;

import java.util.Locale;
import java.util.Objects;
import org.clustertest.core.RegistrationException;
import org.clustertest.core.TestClass;

/**
 * A fixture declaration: the test class providing the fixture and the scope it is shared at.
 */
public final class TestFixture {
    private final TestClass<?> test;
    private final FixtureScope scope;

    public TestFixture(TestClass<?> test, FixtureScope scope) {
        this.test = Objects.requireNonNull(test, "test");
        this.scope = Objects.requireNonNull(scope, "scope");
        if (scope.requiresRunOnly() && !test.isRunOnly()) {
            throw new RegistrationException(
                "incompatible scope for fixture " + test.nestedName() + "; scope '"
                    + scope.name().toLowerCase(Locale.ROOT) + "' only supports run-only fixtures"
            );
        }
    }

    public static TestFixture of(Class<?> test, FixtureScope scope) {
        return new TestFixture(TestClass.forType(test), scope);
    }

    public TestClass<?> test() {
        return test;
    }

    public FixtureScope scope() {
        return scope;
    }

    public int numVariants() {
        return test.numVariants();
    }

    /**
     * Unscoped name of one variant of the fixture.
     */
    public String name(int variantId) {
        return test.fullName(variantId);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TestFixture other)) {
            return false;
        }
        return test.equals(other.test) && scope == other.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, scope);
    }

    @Override
    public String toString() {
        return "TestFixture{" + test.nestedName() + ", " + scope + "}";
    }
}
