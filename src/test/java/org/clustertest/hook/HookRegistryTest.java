package org.clustertest.hook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.clustertest.core.RegistrationException;
import org.clustertest.core.RegressionTest;
import org.clustertest.core.TestClass;
import org.clustertest.core.TestConstruction;
import org.junit.jupiter.api.Test;

class HookRegistryTest {
    @Test
    void mapsStagesToPhaseNames() {
        assertEquals("pre_compile", Stage.COMPILE.prePhase());
        assertEquals("post_compile_wait", Stage.COMPILE.postPhase());
        assertEquals("post_run_wait", Stage.RUN.postPhase());
        assertEquals("post_init", Stage.INIT.postPhase());
        assertFalse(Stage.INIT.acceptsPreHooks());
        assertEquals(Stage.SANITY, Stage.parse("sanity"));
        assertThrows(IllegalArgumentException.class, () -> Stage.parse("deploy"));
    }

    @Test
    void bucketsOwnHooksPerPhase() {
        HookRegistry registry = HookRegistry.create(BaseTest.class);

        assertEquals(List.of("pre_run", "post_setup"), List.copyOf(registry.phases()));
        assertEquals(List.of("prepare"), names(registry.hooks("post_setup")));
        assertEquals(List.of("announce"), names(registry.hooks("pre_run")));
        assertTrue(registry.hooks("post_cleanup").isEmpty());
        assertFalse(registry.contains("post_cleanup"));
    }

    @Test
    void subclassHookReplacesInheritedHookOfTheSameName() {
        HookRegistry registry = HookRegistry.forClass(OverridingTest.class);

        List<Hook> setupHooks = registry.hooks("post_setup");
        assertEquals(1, setupHooks.size());
        assertSame(OverridingTest.class, setupHooks.get(0).declaringClass());

        OverridingTest test = instantiate(OverridingTest.class);
        registry.runHooks("post_setup", test);

        assertEquals(List.of("overriding.prepare"), test.calls);
    }

    @Test
    void inheritedHookDispatchesToTheOverridingMethod() {
        HookRegistry registry = HookRegistry.forClass(UnannotatedOverrideTest.class);

        List<Hook> setupHooks = registry.hooks("post_setup");
        assertEquals(1, setupHooks.size());
        assertSame(BaseTest.class, setupHooks.get(0).declaringClass());

        UnannotatedOverrideTest test = instantiate(UnannotatedOverrideTest.class);
        registry.runHooks("post_setup", test);

        assertEquals(List.of("unannotated.prepare"), test.calls);
    }

    @Test
    void ownHooksComeBeforeInheritedOnes() {
        HookRegistry registry = HookRegistry.forClass(ExtendingTest.class);

        assertEquals(List.of("verify", "announce"), names(registry.hooks("pre_run")));
    }

    @Test
    void stageRunsBetweenItsPreAndPostHooks() {
        ExtendingTest test = instantiate(ExtendingTest.class);

        test.runStage();

        assertEquals(List.of("extending.verify", "base.announce", "run", "extending.collect"), test.calls);
    }

    @Test
    void defaultMethodsOfImplementedInterfacesAreNotHooks() {
        HookRegistry registry = HookRegistry.forClass(MixinUserTest.class);

        assertEquals(List.of("ownSetup"), names(registry.hooks("post_setup")));
    }

    @Test
    void disabledHookIsSkippedInEveryPhase() {
        ToggleTest test = instantiate(ToggleTest.class);
        HookRegistry registry = HookRegistry.forClass(ToggleTest.class);
        test.disableHook("toggle");

        registry.attachHooks("compile", t -> test.calls.add("compile")).run(test);
        registry.attachHooks("compile_wait", t -> test.calls.add("compile_wait")).run(test);

        assertEquals(List.of("keep:pre", "compile", "compile_wait", "keep:post"), test.calls);
    }

    @Test
    void dependencyResolversRunFirstInPostSetup() {
        HookRegistry registry = HookRegistry.forClass(DependentTest.class);

        List<Hook> setupHooks = registry.hooks("post_setup");
        assertEquals(List.of("bindBuild", "aaaSetup"), names(setupHooks));
        assertTrue(setupHooks.get(0).resolvesDependencies());
        assertEquals(List.of("build"), setupHooks.get(0).dependencyNames());
    }

    @Test
    void dependencyLookupIsBoundToTheTest() {
        DependentTest test = instantiate(DependentTest.class);
        BaseTest build = instantiate(BaseTest.class);
        List<String> requested = new ArrayList<>();
        test.dependsOn("build");
        test.setDependencyResolver((requester, target, environ) -> {
            requested.add(requester.name() + "->" + target + "@" + environ);
            return build;
        });

        HookRegistry.forClass(DependentTest.class).runHooks("post_setup", test);

        assertSame(build, test.resolved);
        assertEquals(List.of("DependentTest->build@gnu"), requested);
    }

    @Test
    void rejectsPreInitHooks() {
        RegistrationException error =
            assertThrows(RegistrationException.class, () -> HookRegistry.create(PreInitTest.class));

        assertTrue(error.getMessage().contains("pre-init hooks are not allowed"));
    }

    @Test
    void rejectsParametersWithoutDependencyResolution() {
        assertThrows(RegistrationException.class, () -> HookRegistry.create(ParameterizedHookTest.class));
    }

    @Test
    void checkedHookFailuresAreWrapped() {
        FailingHookTest test = instantiate(FailingHookTest.class);

        HookExecutionException error = assertThrows(
            HookExecutionException.class,
            () -> HookRegistry.forClass(FailingHookTest.class).runHooks("post_sanity", test)
        );

        assertEquals("check", error.hookName());
    }

    @Test
    void mergeReturnsANewRegistry() {
        HookRegistry own = HookRegistry.create(ExtendingTest.class);
        HookRegistry merged = own.merge(HookRegistry.create(BaseTest.class));

        assertEquals(List.of("verify"), names(own.hooks("pre_run")));
        assertEquals(List.of("verify", "announce"), names(merged.hooks("pre_run")));
        assertTrue(HookRegistry.empty().isEmpty());
    }

    private static <T extends RegressionTest> T instantiate(Class<T> type) {
        return TestClass.of(type).instantiate(TestConstruction.builder().build());
    }

    private static List<String> names(List<Hook> hooks) {
        List<String> names = new ArrayList<>();
        for (Hook hook : hooks) {
            names.add(hook.name());
        }
        return names;
    }

    static class BaseTest extends RegressionTest {
        final List<String> calls = new ArrayList<>();

        BaseTest(TestConstruction construction) {
            super(construction);
        }

        @RunAfter(Stage.SETUP)
        void prepare() {
            calls.add("base.prepare");
        }

        @RunBefore(Stage.RUN)
        void announce() {
            calls.add("base.announce");
        }

        void runStage() {
            executeStage("run", () -> calls.add("run"));
        }
    }

    static final class OverridingTest extends BaseTest {
        OverridingTest(TestConstruction construction) {
            super(construction);
        }

        @Override
        @RunAfter(Stage.SETUP)
        void prepare() {
            calls.add("overriding.prepare");
        }
    }

    static final class UnannotatedOverrideTest extends BaseTest {
        UnannotatedOverrideTest(TestConstruction construction) {
            super(construction);
        }

        @Override
        void prepare() {
            calls.add("unannotated.prepare");
        }
    }

    static final class ExtendingTest extends BaseTest {
        ExtendingTest(TestConstruction construction) {
            super(construction);
        }

        @RunBefore(Stage.RUN)
        void verify() {
            calls.add("extending.verify");
        }

        @RunAfter(Stage.RUN)
        void collect() {
            calls.add("extending.collect");
        }

        @Override
        void runStage() {
            executeStage("run", () -> calls.add("run"));
            executeStage("run_wait", () -> { });
        }
    }

    interface SetupMixin {
        @RunAfter(Stage.SETUP)
        default void mixinSetup() {
        }
    }

    static final class MixinUserTest extends RegressionTest implements SetupMixin {
        MixinUserTest(TestConstruction construction) {
            super(construction);
        }

        @RunAfter(Stage.SETUP)
        void ownSetup() {
        }
    }

    static final class ToggleTest extends RegressionTest {
        final List<String> calls = new ArrayList<>();

        ToggleTest(TestConstruction construction) {
            super(construction);
        }

        @RunBefore(Stage.COMPILE)
        @RunAfter(Stage.COMPILE)
        void toggle() {
            calls.add("toggle");
        }

        @RunBefore(Stage.COMPILE)
        void keepBefore() {
            calls.add("keep:pre");
        }

        @RunAfter(Stage.COMPILE)
        void keepAfter() {
            calls.add("keep:post");
        }
    }

    static final class DependentTest extends RegressionTest {
        RegressionTest resolved;

        DependentTest(TestConstruction construction) {
            super(construction);
        }

        @RunAfter(Stage.SETUP)
        void aaaSetup() {
        }

        @RequireDeps
        void bindBuild(@DependencyName("build") DependencyLookup build) {
            resolved = build.resolve("gnu");
        }
    }

    static final class PreInitTest extends RegressionTest {
        PreInitTest(TestConstruction construction) {
            super(construction);
        }

        @RunBefore(Stage.INIT)
        void tooEarly() {
        }
    }

    static final class ParameterizedHookTest extends RegressionTest {
        ParameterizedHookTest(TestConstruction construction) {
            super(construction);
        }

        @RunAfter(Stage.SETUP)
        void configure(String value) {
        }
    }

    static final class FailingHookTest extends RegressionTest {
        FailingHookTest(TestConstruction construction) {
            super(construction);
        }

        @RunAfter(Stage.SANITY)
        void check() throws Exception {
            throw new Exception("sanity failed");
        }
    }
}
