package org.clustertest.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.clustertest.fixture.FixtureRegistry;

/**
 * Base class of every regression test.
 *
 * <p>Concrete tests declare a constructor accepting a {@link TestConstruction} and pass it to
 * {@code super}. Instances are created through {@link TestClass#instantiate(TestConstruction)},
 * which runs post-init hooks and injects fixtures after the constructor returns.
 */
public abstract class RegressionTest {
    private final TestClass<?> testClass;
    private final Integer variantNum;
    private final Map<String, String> parameters;
    private final Map<String, Object> arguments;
    private final List<TestDependency> dependencies = new ArrayList<>();
    private final Set<String> disabledHooks = new LinkedHashSet<>();
    private String name;
    private List<String> validSystems;
    private List<String> validProgEnvirons;
    private FixtureRegistry fixtureRegistry;
    private DependencyResolver dependencyResolver;

    protected RegressionTest(TestConstruction construction) {
        Objects.requireNonNull(construction, "construction");
        this.testClass = TestClass.forType(getClass());
        this.variantNum = construction.variantNum().orElse(null);
        this.parameters = variantNum == null
            ? Map.of()
            : testClass.parameterSpace().valuesAt(testClass.parameterIndex(variantNum));
        this.arguments = construction.arguments();
        this.name = construction.name().orElseGet(() -> testClass.fullName(variantNum));
        this.validSystems = construction.validSystems().orElse(null);
        this.validProgEnvirons = construction.validProgEnvirons().orElse(null);
    }

    public final TestClass<?> testClass() {
        return testClass;
    }

    public final String name() {
        return name;
    }

    public final Optional<Integer> variantNum() {
        return Optional.ofNullable(variantNum);
    }

    /**
     * Valid systems, or empty while still undefined.
     */
    public final Optional<List<String>> validSystems() {
        return Optional.ofNullable(validSystems);
    }

    public final Optional<List<String>> validProgEnvirons() {
        return Optional.ofNullable(validProgEnvirons);
    }

    protected final void setValidSystems(String... systems) {
        setValidSystems(List.of(systems));
    }

    protected final void setValidSystems(List<String> systems) {
        this.validSystems = List.copyOf(Objects.requireNonNull(systems, "systems"));
    }

    protected final void setValidProgEnvirons(String... environs) {
        setValidProgEnvirons(List.of(environs));
    }

    protected final void setValidProgEnvirons(List<String> environs) {
        this.validProgEnvirons = List.copyOf(Objects.requireNonNull(environs, "environs"));
    }

    public final Map<String, String> parameters() {
        return parameters;
    }

    public final String parameter(String parameterName) {
        String value = parameters.get(parameterName);
        if (value == null) {
            throw new IllegalArgumentException("unknown parameter '" + parameterName + "' in test " + name);
        }
        return value;
    }

    public final Map<String, Object> arguments() {
        return arguments;
    }

    public final Optional<Object> argument(String key) {
        return Optional.ofNullable(arguments.get(key));
    }

    public final void dependsOn(String target, DependencyMode mode) {
        dependencies.add(new TestDependency(target, mode));
    }

    public final void dependsOn(String target) {
        dependsOn(target, DependencyMode.BY_ENVIRONMENT);
    }

    public final List<TestDependency> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public final void disableHook(String hookName) {
        Objects.requireNonNull(hookName, "hookName");
        disabledHooks.add(hookName);
    }

    public final Set<String> disabledHooks() {
        return Collections.unmodifiableSet(disabledHooks);
    }

    /**
     * Fixtures requested by this instance; empty when its class declares none.
     */
    public final Optional<FixtureRegistry> fixtureRegistry() {
        return Optional.ofNullable(fixtureRegistry);
    }

    public final void setDependencyResolver(DependencyResolver dependencyResolver) {
        this.dependencyResolver = Objects.requireNonNull(dependencyResolver, "dependencyResolver");
    }

    public final RegressionTest getDependency(String target, String environ) {
        Objects.requireNonNull(target, "target");
        if (dependencyResolver == null) {
            throw new IllegalStateException("dependencies of test " + name + " are not resolved yet");
        }
        boolean declared = false;
        for (TestDependency dependency : dependencies) {
            if (dependency.target().equals(target)) {
                declared = true;
                break;
            }
        }
        if (!declared) {
            throw new IllegalArgumentException("test " + name + " does not depend on " + target);
        }
        return Objects.requireNonNull(
            dependencyResolver.getDependency(this, target, environ),
            "dependency " + target
        );
    }

    /**
     * Runs a pipeline stage body surrounded by the pre and post hooks attached to it.
     */
    protected final void executeStage(String functionName, Runnable body) {
        Objects.requireNonNull(body, "body");
        testClass.hooks().attachHooks(functionName, test -> body.run()).run(this);
    }

    final void applyScope(TestConstruction construction) {
        construction.name().ifPresent(scopedName -> this.name = scopedName);
        construction.validSystems().ifPresent(this::setValidSystems);
        construction.validProgEnvirons().ifPresent(this::setValidProgEnvirons);
    }

    final void applyReset(Set<SysEnvReset> reset) {
        if (reset.contains(SysEnvReset.VALID_SYSTEMS)) {
            this.validSystems = List.of("*");
        }
        if (reset.contains(SysEnvReset.VALID_PROG_ENVIRONS)) {
            this.validProgEnvirons = List.of("*");
        }
    }

    final void attachFixtureRegistry(FixtureRegistry registry) {
        this.fixtureRegistry = registry;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + "}";
    }
}
