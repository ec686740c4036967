package org.clustertest.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.clustertest.core.RegressionTest;
import org.clustertest.core.SysEnvReset;
import org.clustertest.core.TestClass;
import org.clustertest.core.TestConstruction;
import org.clustertest.fixture.FixtureRegistry;
import org.clustertest.obs.JsonLinesLogger;
import org.clustertest.obs.LogContext;
import org.clustertest.runtime.TestRuntime;

/**
 * Registered test constructions and the expansion of their fixtures into a flat instance list.
 *
 * <p>Registration order is preserved, which makes instantiation deterministic. Not thread-safe.
 */
public final class TestRegistry {
    static final String COMPONENT = "registry";

    private final JsonLinesLogger logger;
    private final List<TestRecipe> recipes = new ArrayList<>();
    private final Set<TestClass<?>> skipped = new LinkedHashSet<>();

    public TestRegistry(JsonLinesLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public void add(TestRecipe recipe) {
        recipes.add(Objects.requireNonNull(recipe, "recipe"));
    }

    public void add(TestClass<?> testClass, Integer variantNum, Map<String, ?> arguments) {
        add(new TestRecipe(testClass, variantNum, new LinkedHashMap<String, Object>(arguments)));
    }

    /**
     * Excludes every registered construction of {@code testClass} from instantiation.
     */
    public void skip(TestClass<?> testClass) {
        skipped.add(Objects.requireNonNull(testClass, "testClass"));
    }

    public boolean isSkipped(TestClass<?> testClass) {
        return skipped.contains(testClass);
    }

    /**
     * Registered classes in first-registration order.
     */
    public Set<TestClass<?>> testClasses() {
        Set<TestClass<?>> classes = new LinkedHashSet<>();
        for (TestRecipe recipe : recipes) {
            classes.add(recipe.testClass());
        }
        return Collections.unmodifiableSet(classes);
    }

    public boolean contains(TestClass<?> testClass) {
        for (TestRecipe recipe : recipes) {
            if (recipe.testClass().equals(testClass)) {
                return true;
            }
        }
        return false;
    }

    public List<TestRecipe> recipes() {
        return Collections.unmodifiableList(recipes);
    }

    public int size() {
        return recipes.size();
    }

    public List<RegressionTest> instantiateAll(TestRuntime runtime) {
        return instantiateAll(runtime, EnumSet.noneOf(SysEnvReset.class));
    }

    /**
     * Instantiates every registered test that is not skipped, then their fixtures level by level.
     *
     * <p>Each wave collects the fixture registries of the instances created by the previous one.
     * Entries already instantiated in an earlier wave are removed, so every scoped fixture name is
     * instantiated at most once. Expansion stops at the first wave that requests nothing new.
     *
     * @return the leaf tests followed by their fixtures in discovery order
     */
    public List<RegressionTest> instantiateAll(TestRuntime runtime, Set<SysEnvReset> reset) {
        Objects.requireNonNull(reset, "reset");
        TestInstantiator leaves = new TestInstantiator(logger, "instantiate_leaves");
        List<RegressionTest> instances = new ArrayList<>();
        for (TestRecipe recipe : recipes) {
            if (skipped.contains(recipe.testClass())) {
                continue;
            }
            TestConstruction construction = TestConstruction.builder()
                .variantNum(recipe.variantNum())
                .arguments(recipe.arguments())
                .reset(reset)
                .runtime(runtime)
                .build();
            leaves.create(recipe.testClass(), construction).ifPresent(instances::add);
        }
        logger.info(
            "leaf tests instantiated",
            LogContext.of(COMPONENT, "instantiate_leaves"),
            Map.of("recipes", recipes.size(), "instances", instances.size())
        );

        TestInstantiator fixtures = new TestInstantiator(logger, "instantiate_fixtures");
        FixtureRegistry seen = new FixtureRegistry();
        List<RegressionTest> wave = instances;
        int depth = 0;
        while (true) {
            FixtureRegistry requested = new FixtureRegistry();
            for (RegressionTest instance : wave) {
                Optional<FixtureRegistry> registry = instance.fixtureRegistry();
                registry.ifPresent(requested::update);
            }
            FixtureRegistry fresh = requested.difference(seen);
            if (fresh.isEmpty()) {
                break;
            }
            depth++;
            wave = fresh.instantiateAll(runtime, fixtures);
            instances.addAll(wave);
            seen.update(fresh);
            logger.info(
                "fixture wave instantiated",
                LogContext.of(COMPONENT, "instantiate_fixtures"),
                Map.of("wave", depth, "requested", fresh.size(), "instances", wave.size())
            );
        }
        return instances;
    }
}
