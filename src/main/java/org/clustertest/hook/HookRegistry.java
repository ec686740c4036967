package org.clustertest.hook;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.clustertest.core.RegistrationException;
import org.clustertest.core.RegressionTest;

/**
 * Pipeline hooks of a test class, bucketed per phase ({@code pre_<function>} or
 * {@code post_<function>}).
 *
 * <p>Within a phase, hooks form an override table keyed by name. Merging keeps the entry that was
 * inserted first, so the effective registry of a class is built from its own hooks first and its
 * superclass's hooks second. Registries are immutable.
 */
public final class HookRegistry {
    public static final String PRE_PREFIX = "pre_";
    public static final String POST_PREFIX = "post_";
    public static final String POST_INIT = POST_PREFIX + "init";
    public static final String POST_SETUP = POST_PREFIX + "setup";

    private static final HookRegistry EMPTY = new HookRegistry(Map.of());

    private static final ClassValue<HookRegistry> EFFECTIVE = new ClassValue<>() {
        @Override
        protected HookRegistry computeValue(Class<?> type) {
            HookRegistry own = create(type);
            Class<?> superclass = type.getSuperclass();
            if (superclass == null || superclass == Object.class || superclass == RegressionTest.class) {
                return own;
            }
            return own.merge(forClass(superclass));
        }
    };

    private final Map<String, Map<String, Hook>> hooks;

    private HookRegistry(Map<String, ? extends Map<String, Hook>> hooks) {
        Map<String, Map<String, Hook>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<String, Hook>> entry : hooks.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.hooks = Collections.unmodifiableMap(copy);
    }

    public static HookRegistry empty() {
        return EMPTY;
    }

    /**
     * Effective registry of a test class: its own hooks overriding those inherited from its
     * superclass chain.
     */
    public static HookRegistry forClass(Class<?> type) {
        return EFFECTIVE.get(Objects.requireNonNull(type, "type"));
    }

    /**
     * Registry of the hooks declared directly on {@code type}.
     *
     * <p>Java reflection does not expose declaration order, so hooks of one class attached to the
     * same phase are ordered by method name. Dependency-resolving hooks not attached to any phase
     * are placed at the front of the post-setup phase.
     */
    public static HookRegistry create(Class<?> type) {
        Objects.requireNonNull(type, "type");
        Method[] methods = type.getDeclaredMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName).thenComparing(Method::toGenericString));

        Map<String, List<Hook>> localHooks = new LinkedHashMap<>();
        List<Hook> dependencyResolvers = new ArrayList<>();
        for (Method method : methods) {
            if (method.isSynthetic() || method.isBridge()) {
                continue;
            }
            RunBefore[] before = method.getAnnotationsByType(RunBefore.class);
            RunAfter[] after = method.getAnnotationsByType(RunAfter.class);
            boolean requiresDeps = method.isAnnotationPresent(RequireDeps.class);
            if (before.length == 0 && after.length == 0 && !requiresDeps) {
                continue;
            }

            Hook hook = Hook.of(method);
            for (RunBefore attachment : before) {
                Stage stage = attachment.value();
                if (!stage.acceptsPreHooks()) {
                    throw new RegistrationException(
                        "pre-init hooks are not allowed: " + type.getSimpleName() + "." + method.getName()
                    );
                }
                localHooks.computeIfAbsent(stage.prePhase(), phase -> new ArrayList<>()).add(hook);
            }
            for (RunAfter attachment : after) {
                localHooks.computeIfAbsent(attachment.value().postPhase(), phase -> new ArrayList<>()).add(hook);
            }
            if (requiresDeps && before.length == 0 && after.length == 0) {
                dependencyResolvers.add(hook);
            }
        }

        if (!dependencyResolvers.isEmpty()) {
            List<Hook> postSetup = new ArrayList<>(dependencyResolvers);
            postSetup.addAll(localHooks.getOrDefault(POST_SETUP, List.of()));
            localHooks.put(POST_SETUP, postSetup);
        }
        return EMPTY.merge(localHooks);
    }

    /**
     * Returns a new registry holding this registry's hooks followed by {@code other}'s. A hook of
     * {@code other} is dropped when a hook with the same name is already present in its phase.
     */
    public HookRegistry merge(HookRegistry other) {
        Objects.requireNonNull(other, "other");
        Map<String, List<Hook>> otherHooks = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Hook>> entry : other.hooks.entrySet()) {
            otherHooks.put(entry.getKey(), List.copyOf(entry.getValue().values()));
        }
        return merge(otherHooks);
    }

    private HookRegistry merge(Map<String, List<Hook>> additions) {
        Map<String, LinkedHashMap<String, Hook>> merged = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Hook>> entry : hooks.entrySet()) {
            merged.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
        }
        for (Map.Entry<String, List<Hook>> entry : additions.entrySet()) {
            LinkedHashMap<String, Hook> phaseHooks = merged.computeIfAbsent(entry.getKey(), phase -> new LinkedHashMap<>());
            for (Hook hook : entry.getValue()) {
                phaseHooks.putIfAbsent(hook.name(), hook);
            }
        }
        return new HookRegistry(merged);
    }

    public Set<String> phases() {
        return hooks.keySet();
    }

    public boolean contains(String phase) {
        return hooks.containsKey(phase);
    }

    /**
     * Hooks attached to {@code phase} in execution order; empty when the phase has none.
     */
    public List<Hook> hooks(String phase) {
        Map<String, Hook> phaseHooks = hooks.get(phase);
        return phaseHooks == null ? List.of() : List.copyOf(phaseHooks.values());
    }

    public boolean isEmpty() {
        return hooks.isEmpty();
    }

    /**
     * Runs the hooks of {@code phase} on {@code test}, skipping those disabled on the instance.
     */
    public void runHooks(String phase, RegressionTest test) {
        Objects.requireNonNull(test, "test");
        Set<String> disabled = test.disabledHooks();
        for (Hook hook : hooks(phase)) {
            if (disabled.contains(hook.name())) {
                continue;
            }
            hook.invoke(test);
        }
    }

    /**
     * Wraps a pipeline function so that its pre hooks run before it and its post hooks after it.
     *
     * @param functionName name of the pipeline function, e.g. {@code compile_wait}
     */
    public StageFunction attachHooks(String functionName, StageFunction function) {
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(function, "function");
        String prePhase = PRE_PREFIX + functionName;
        String postPhase = POST_PREFIX + functionName;
        return test -> {
            runHooks(prePhase, test);
            function.run(test);
            runHooks(postPhase, test);
        };
    }

    @Override
    public String toString() {
        return "HookRegistry" + hooks;
    }
}
