package org.clustertest.fixture;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import org.clustertest.core.ConfigurationException;
import org.clustertest.core.RegistrationException;
import org.clustertest.core.RegressionTest;
import org.clustertest.runtime.SystemTopology;
import org.clustertest.runtime.TestRuntime;

/**
 * Fixtures visible to a class: those inherited from its superclass and its directly implemented
 * interfaces, plus its own {@link Fixture} declarations.
 *
 * <p>The space enumerates every combination of fixture variants. Combination {@code k} is the
 * mixed-radix decomposition of {@code k} over the fixtures' variant counts in declaration order,
 * the last fixture varying fastest.
 */
public final class FixtureSpace implements Iterable<Map<String, Integer>> {
    private static final String ALL = "*";

    private static final ClassValue<FixtureSpace> SPACES = new ClassValue<>() {
        @Override
        protected FixtureSpace computeValue(Class<?> type) {
            FixtureSpace space = new FixtureSpace();
            for (Class<?> base : bases(type)) {
                space.join(forClass(base), type);
            }
            space.extend(type);
            return space.freeze();
        }
    };

    private final Map<String, TestFixture> fixtures;
    private final Map<String, Class<?>> declaringTypes;
    private final int[] radices;
    private final int size;

    private FixtureSpace() {
        this.fixtures = new LinkedHashMap<>();
        this.declaringTypes = new LinkedHashMap<>();
        this.radices = new int[0];
        this.size = 1;
    }

    private FixtureSpace(Map<String, TestFixture> fixtures, Map<String, Class<?>> declaringTypes) {
        this.fixtures = Collections.unmodifiableMap(new LinkedHashMap<>(fixtures));
        this.declaringTypes = Collections.unmodifiableMap(new LinkedHashMap<>(declaringTypes));
        this.radices = new int[fixtures.size()];
        int product = 1;
        int i = 0;
        for (TestFixture fixture : fixtures.values()) {
            radices[i] = fixture.numVariants();
            product = Math.multiplyExact(product, radices[i]);
            i++;
        }
        this.size = product;
    }

    public static FixtureSpace forClass(Class<?> type) {
        return SPACES.get(Objects.requireNonNull(type, "type"));
    }

    /**
     * Merges the fixtures of a base type into this space.
     *
     * <p>A name defined by more than one base is a conflict, with one exception: the same
     * {@code @Fixture} declaration reached through two bases, such as a mixin interface that a
     * superclass already implements, is merged once. Two different declarations sharing a name
     * still conflict.
     *
     * @throws RegistrationException when a fixture name is already defined by another base
     */
    void join(FixtureSpace other, Class<?> type) {
        for (Map.Entry<String, TestFixture> entry : other.fixtures.entrySet()) {
            String name = entry.getKey();
            Class<?> declaringType = other.declaringTypes.get(name);
            if (fixtures.containsKey(name)) {
                // The same declaration reached through two paths of the hierarchy.
                if (declaringTypes.get(name) == declaringType) {
                    continue;
                }
                throw new RegistrationException(
                    "fixture space conflict: fixture '" + name + "' is defined in more than one base class of class '"
                        + type.getSimpleName() + "'"
                );
            }
            fixtures.put(name, entry.getValue());
            declaringTypes.put(name, declaringType);
        }
    }

    /**
     * Adds the fixtures declared directly on {@code type}, replacing inherited ones of the same name.
     *
     * @throws RegistrationException when a fixture name is declared twice on {@code type}, or when
     *     {@code type} declares a field named after a fixture
     */
    void extend(Class<?> type) {
        Set<String> own = new LinkedHashSet<>();
        for (Fixture declaration : type.getDeclaredAnnotationsByType(Fixture.class)) {
            String name = declaration.name() == null ? "" : declaration.name().trim();
            if (name.isEmpty()) {
                throw new RegistrationException("fixture name must not be blank in " + type.getName());
            }
            if (!own.add(name)) {
                throw new RegistrationException("fixture '" + name + "' is declared more than once in " + type.getName());
            }
            fixtures.put(name, TestFixture.of(declaration.test(), declaration.scope()));
            declaringTypes.put(name, type);
        }

        for (Field field : type.getDeclaredFields()) {
            if (!field.isSynthetic() && fixtures.containsKey(field.getName())) {
                throw new RegistrationException(
                    "fixture '" + field.getName() + "' must be modified through @" + Fixture.class.getSimpleName()
                );
            }
        }
    }

    private FixtureSpace freeze() {
        return new FixtureSpace(fixtures, declaringTypes);
    }

    /**
     * Number of fixture variant combinations; one for an empty space.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return fixtures.isEmpty();
    }

    public Map<String, TestFixture> fixtures() {
        return fixtures;
    }

    /**
     * Fixture declared under {@code name}.
     *
     * @throws NoSuchElementException when no such fixture exists
     */
    public TestFixture get(String name) {
        TestFixture fixture = fixtures.get(name);
        if (fixture == null) {
            throw new NoSuchElementException("no fixture named '" + name + "'");
        }
        return fixture;
    }

    /**
     * Variant id of every fixture in combination {@code index}.
     */
    public Map<String, Integer> get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("fixture combination " + index + " out of range [0, " + size + ")");
        }
        List<String> names = new ArrayList<>(fixtures.keySet());
        int[] selected = new int[names.size()];
        int remainder = index;
        for (int i = names.size() - 1; i >= 0; i--) {
            selected[i] = remainder % radices[i];
            remainder /= radices[i];
        }
        Map<String, Integer> combination = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            combination.put(names.get(i), selected[i]);
        }
        return Collections.unmodifiableMap(combination);
    }

    @Override
    public Iterator<Map<String, Integer>> iterator() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < size;
            }

            @Override
            public Map<String, Integer> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }

    /**
     * Registers the fixtures of combination {@code fixtureIndex} on {@code test} and records a
     * dependency edge to every generated fixture instance.
     *
     * @return the test's fixture registry, or null when the space is empty or no index is given
     * @throws ConfigurationException when the index is out of range, the test's valid systems or
     *     programming environments are undefined, or the runtime needed to expand them is missing
     */
    public FixtureRegistry inject(RegressionTest test, Integer fixtureIndex, TestRuntime runtime) {
        Objects.requireNonNull(test, "test");
        if (fixtureIndex != null && fixtureIndex >= size) {
            throw new ConfigurationException("fixture index out of range for " + test.getClass().getSimpleName());
        }
        if (fixtures.isEmpty() || fixtureIndex == null) {
            return null;
        }

        List<String> partitions = resolvePartitions(test, runtime);
        List<String> environs = resolveEnvirons(test, runtime);
        Map<String, Integer> variants = get(fixtureIndex);

        FixtureRegistry registry = new FixtureRegistry();
        for (Map.Entry<String, TestFixture> entry : fixtures.entrySet()) {
            TestFixture fixture = entry.getValue();
            int variantId = variants.get(entry.getKey());
            List<String> names = registry.add(fixture, variantId, test.name(), partitions, environs);
            for (String name : names) {
                test.dependsOn(name, fixture.scope().dependencyMode());
            }
        }
        return registry;
    }

    private static List<String> resolvePartitions(RegressionTest test, TestRuntime runtime) {
        List<String> systems = test.validSystems()
            .orElseThrow(() -> new ConfigurationException("valid_systems is undefined in test " + test.name()));
        if (systems.contains(ALL) || (runtime != null && systems.contains(runtime.system().name()))) {
            return requireRuntime(runtime, test).partitionFullNames();
        }
        return systems;
    }

    private static List<String> resolveEnvirons(RegressionTest test, TestRuntime runtime) {
        List<String> environs = test.validProgEnvirons()
            .orElseThrow(() -> new ConfigurationException("valid_prog_environs is undefined in test " + test.name()));
        if (!environs.contains(ALL)) {
            return environs;
        }
        return requireRuntime(runtime, test).environNames();
    }

    private static SystemTopology requireRuntime(TestRuntime runtime, RegressionTest test) {
        if (runtime == null) {
            throw new ConfigurationException("no runtime available to resolve the fixtures of test " + test.name());
        }
        return runtime.system();
    }

    private static List<Class<?>> bases(Class<?> type) {
        List<Class<?>> bases = new ArrayList<>();
        Class<?> superclass = type.getSuperclass();
        if (superclass != null && superclass != Object.class) {
            bases.add(superclass);
        }
        Collections.addAll(bases, type.getInterfaces());
        return bases;
    }

    @Override
    public String toString() {
        return "FixtureSpace" + fixtures;
    }
}
