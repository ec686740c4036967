package org.clustertest.core;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.clustertest.fixture.FixtureRegistry;
import org.clustertest.fixture.FixtureSpace;
import org.clustertest.hook.HookRegistry;
import org.clustertest.runtime.TestRuntime;

/**
 * Descriptor of a regression test class: its variant space, fixture declarations, hooks and
 * the way instances of it are constructed. One descriptor exists per Java class.
 *
 * <p>The variants of a class are the product of its parameter space and its fixture space.
 * A variant number {@code n} selects parameter combination {@code n % p} and fixture
 * combination {@code n / p}, where {@code p} is the parameter space size.
 */
public final class TestClass<T extends RegressionTest> {
    private static final ClassValue<TestClass<?>> DESCRIPTORS = new ClassValue<>() {
        @Override
        protected TestClass<?> computeValue(Class<?> type) {
            return new TestClass<>(type.asSubclass(RegressionTest.class));
        }
    };

    // Classes whose variant count is being computed on this thread, in call order.
    private static final ThreadLocal<LinkedHashSet<Class<?>>> RESOLVING =
        ThreadLocal.withInitial(LinkedHashSet::new);

    private final Class<T> javaClass;
    private final TestKind kind;
    private final String nestedName;
    private volatile Integer numVariants;

    private TestClass(Class<T> javaClass) {
        this.javaClass = javaClass;
        this.kind = TestKind.of(javaClass);
        this.nestedName = nestedNameOf(javaClass);
    }

    @SuppressWarnings("unchecked")
    public static <T extends RegressionTest> TestClass<T> of(Class<T> type) {
        return (TestClass<T>) forType(type);
    }

    /**
     * Descriptor for an arbitrary class, failing when it is not a regression test.
     */
    public static TestClass<?> forType(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (!RegressionTest.class.isAssignableFrom(type)) {
            throw new RegistrationException(
                "'" + type.getName() + "' must be a derived class from '" + RegressionTest.class.getSimpleName() + "'"
            );
        }
        return DESCRIPTORS.get(type);
    }

    public Class<T> javaClass() {
        return javaClass;
    }

    public String qualifiedName() {
        return javaClass.getName();
    }

    public String simpleName() {
        return simpleNameOf(javaClass);
    }

    /**
     * Name of the class relative to its top-level class, e.g. {@code Gnu.Tool} for a class
     * {@code Tool} nested in {@code Gnu}. A top-level class, or a class nested directly in one, is
     * named by its simple name. Instance names and dependency targets derive from this name.
     */
    public String nestedName() {
        return nestedName;
    }

    public TestKind kind() {
        return kind;
    }

    public boolean isRunOnly() {
        return kind == TestKind.RUN_ONLY;
    }

    public boolean isAbstract() {
        return Modifier.isAbstract(javaClass.getModifiers()) || parameterSpace().hasUndefinedParameters();
    }

    public ParameterSpace parameterSpace() {
        return ParameterSpace.forClass(javaClass);
    }

    public FixtureSpace fixtureSpace() {
        return FixtureSpace.forClass(javaClass);
    }

    public HookRegistry hooks() {
        return HookRegistry.forClass(javaClass);
    }

    /**
     * Number of concrete variants, at least one.
     *
     * @throws FixtureCycleException when the fixture declarations reachable from this class
     *     lead back to it
     */
    public int numVariants() {
        Integer cached = numVariants;
        if (cached != null) {
            return cached;
        }
        LinkedHashSet<Class<?>> resolving = RESOLVING.get();
        if (!resolving.add(javaClass)) {
            throw new FixtureCycleException(cycleFrom(resolving));
        }
        try {
            int computed = Math.multiplyExact(parameterSpace().size(), fixtureSpace().size());
            numVariants = computed;
            return computed;
        } finally {
            resolving.remove(javaClass);
        }
    }

    public String fullName(Integer variantId) {
        if (variantId == null || numVariants() == 1) {
            return nestedName;
        }
        return nestedName + "_" + variantId;
    }

    public int parameterIndex(int variantNum) {
        return variantNum % parameterSpace().size();
    }

    public int fixtureIndex(int variantNum) {
        return variantNum / parameterSpace().size();
    }

    /**
     * Constructs an instance, then completes it in this order: scoped values are re-applied for
     * fixtures, post-init hooks run, resets are applied and the fixtures are injected.
     */
    public T instantiate(TestConstruction construction) {
        Objects.requireNonNull(construction, "construction");
        if (isAbstract()) {
            throw new RegistrationException(
                "cannot instantiate abstract test '" + qualifiedName() + "': test is abstract "
                    + "or has one or more undefined parameters"
            );
        }
        Integer variant = construction.variantNum().orElse(null);
        if (variant != null && variant >= numVariants()) {
            throw new ConfigurationException(
                "variant " + variant + " out of range for test '" + qualifiedName() + "' ("
                    + numVariants() + " variants)"
            );
        }

        T instance = construct(construction);
        if (construction.scoped()) {
            instance.applyScope(construction);
        }
        hooks().runHooks(HookRegistry.POST_INIT, instance);
        instance.applyReset(construction.reset());
        if (variant != null) {
            TestRuntime runtime = construction.runtime().orElse(null);
            FixtureRegistry registry = fixtureSpace().inject(instance, fixtureIndex(variant), runtime);
            instance.attachFixtureRegistry(registry);
        }
        return instance;
    }

    private T construct(TestConstruction construction) {
        Constructor<T> constructor;
        try {
            constructor = javaClass.getDeclaredConstructor(TestConstruction.class);
        } catch (NoSuchMethodException e) {
            throw new RegistrationException(
                "test '" + qualifiedName() + "' must declare a constructor accepting "
                    + TestConstruction.class.getSimpleName(),
                e
            );
        }
        try {
            constructor.setAccessible(true);
            return constructor.newInstance(construction);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TestInstantiationException("constructor of test '" + qualifiedName() + "' failed", cause);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new RegistrationException("cannot instantiate test '" + qualifiedName() + "'", e);
        }
    }

    private static String nestedNameOf(Class<?> type) {
        StringBuilder name = new StringBuilder(simpleNameOf(type));
        for (Class<?> enclosing = type.getEnclosingClass();
             enclosing != null && enclosing.getEnclosingClass() != null;
             enclosing = enclosing.getEnclosingClass()) {
            name.insert(0, simpleNameOf(enclosing) + ".");
        }
        return name.toString();
    }

    private static String simpleNameOf(Class<?> type) {
        String simpleName = type.getSimpleName();
        return simpleName.isEmpty() ? type.getName() : simpleName;
    }

    private List<String> cycleFrom(LinkedHashSet<Class<?>> resolving) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (Class<?> type : resolving) {
            if (type == javaClass) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(type.getSimpleName());
            }
        }
        cycle.add(javaClass.getSimpleName());
        return cycle;
    }

    @Override
    public String toString() {
        return "TestClass{" + qualifiedName() + "}";
    }
}
