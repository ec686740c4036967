package org.clustertest.fixture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.clustertest.core.ConfigurationException;
import org.clustertest.core.RegressionTest;
import org.clustertest.core.TestClass;
import org.clustertest.core.TestConstruction;
import org.clustertest.runtime.TestRuntime;

/**
 * Scoped fixture instances requested by one or more tests, keyed by fixture class and scoped
 * name.
 *
 * <p>The scoped name decides sharing: tests requesting the same fixture at session, partition or
 * environment scope produce the same names and therefore share instances, while test-scoped names
 * embed the requesting test's name. Iteration follows insertion order.
 */
public final class FixtureRegistry {
    private static final String NAME_SEPARATOR = "_";

    private final Map<TestClass<?>, Map<String, FixtureBinding>> registry = new LinkedHashMap<>();

    /**
     * Registers the instances of {@code fixture} needed by a test.
     *
     * @param variantId variant of the fixture class
     * @param branch name of the requesting test
     * @param partitions partition full names the requesting test runs on
     * @param environs programming environments the requesting test runs with
     * @return the generated scoped names, in generation order
     */
    public List<String> add(
        TestFixture fixture,
        int variantId,
        String branch,
        List<String> partitions,
        List<String> environs
    ) {
        Objects.requireNonNull(fixture, "fixture");
        Objects.requireNonNull(branch, "branch");
        Objects.requireNonNull(partitions, "partitions");
        Objects.requireNonNull(environs, "environs");

        String fixtureName = fixture.name(variantId);
        Map<String, FixtureBinding> variants = registry.computeIfAbsent(fixture.test(), test -> new LinkedHashMap<>());
        List<String> names = new ArrayList<>();
        switch (fixture.scope()) {
            case SESSION -> {
                String environ = first(environs, "programming environments", fixtureName);
                String partition = first(partitions, "partitions", fixtureName);
                variants.put(fixtureName, new FixtureBinding(variantId, List.of(environ), List.of(partition)));
                names.add(fixtureName);
            }
            case PARTITION -> {
                for (String partition : partitions) {
                    String environ = first(environs, "programming environments", fixtureName);
                    String name = join(fixtureName, partition);
                    variants.put(name, new FixtureBinding(variantId, List.of(environ), List.of(partition)));
                    names.add(name);
                }
            }
            case ENVIRONMENT -> {
                for (String partition : partitions) {
                    for (String environ : environs) {
                        String name = join(fixtureName, partition, environ);
                        variants.put(name, new FixtureBinding(variantId, List.of(environ), List.of(partition)));
                        names.add(name);
                    }
                }
            }
            case TEST -> {
                String name = join(fixtureName, branch);
                variants.put(name, new FixtureBinding(variantId, environs, partitions));
                names.add(name);
            }
            default -> throw new IllegalStateException("unknown scope " + fixture.scope());
        }
        return List.copyOf(names);
    }

    /**
     * Merges the entries of {@code other} into this registry; entries of {@code other} win on a
     * key collision.
     */
    public void update(FixtureRegistry other) {
        Objects.requireNonNull(other, "other");
        for (Map.Entry<TestClass<?>, Map<String, FixtureBinding>> entry : other.registry.entrySet()) {
            registry.computeIfAbsent(entry.getKey(), test -> new LinkedHashMap<>()).putAll(entry.getValue());
        }
    }

    /**
     * New registry holding the entries of this registry whose class and name are not registered
     * in {@code other}.
     */
    public FixtureRegistry difference(FixtureRegistry other) {
        Objects.requireNonNull(other, "other");
        FixtureRegistry result = new FixtureRegistry();
        for (Map.Entry<TestClass<?>, Map<String, FixtureBinding>> entry : registry.entrySet()) {
            Map<String, FixtureBinding> otherVariants = other.registry.getOrDefault(entry.getKey(), Map.of());
            for (Map.Entry<String, FixtureBinding> variant : entry.getValue().entrySet()) {
                if (!otherVariants.containsKey(variant.getKey())) {
                    result.registry.computeIfAbsent(entry.getKey(), test -> new LinkedHashMap<>())
                        .put(variant.getKey(), variant.getValue());
                }
            }
        }
        return result;
    }

    /**
     * Constructs one instance per entry, in insertion order.
     *
     * <p>Each instance receives its scoped name, partitions and environments through its own
     * {@link TestConstruction}. Instances the factory drops are left out of the result.
     */
    public List<RegressionTest> instantiateAll(TestRuntime runtime, InstanceFactory factory) {
        Objects.requireNonNull(factory, "factory");
        List<RegressionTest> instances = new ArrayList<>();
        for (Entry entry : entries()) {
            FixtureBinding binding = entry.binding();
            TestConstruction construction = TestConstruction.builder()
                .name(entry.name())
                .validSystems(binding.partitions())
                .validProgEnvirons(binding.environs())
                .variantNum(binding.variantId())
                .runtime(runtime)
                .scoped(true)
                .build();
            Optional<RegressionTest> instance = factory.create(entry.test(), construction);
            instance.ifPresent(instances::add);
        }
        return instances;
    }

    /**
     * Scoped names registered for {@code test}.
     *
     * @throws NoSuchElementException when no fixture of that class is registered
     */
    public Set<String> names(TestClass<?> test) {
        Map<String, FixtureBinding> variants = registry.get(test);
        if (variants == null) {
            throw new NoSuchElementException(test.qualifiedName() + " is not a registered fixture");
        }
        return Collections.unmodifiableSet(variants.keySet());
    }

    public Optional<FixtureBinding> binding(TestClass<?> test, String name) {
        return Optional.ofNullable(registry.getOrDefault(test, Map.of()).get(name));
    }

    public boolean contains(TestClass<?> test) {
        return registry.containsKey(test);
    }

    public boolean isEmpty() {
        for (Map<String, FixtureBinding> variants : registry.values()) {
            if (!variants.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of scoped instances registered.
     */
    public int size() {
        int size = 0;
        for (Map<String, FixtureBinding> variants : registry.values()) {
            size += variants.size();
        }
        return size;
    }

    public List<Entry> entries() {
        List<Entry> entries = new ArrayList<>();
        for (Map.Entry<TestClass<?>, Map<String, FixtureBinding>> entry : registry.entrySet()) {
            for (Map.Entry<String, FixtureBinding> variant : entry.getValue().entrySet()) {
                entries.add(new Entry(entry.getKey(), variant.getKey(), variant.getValue()));
            }
        }
        return List.copyOf(entries);
    }

    private static String first(List<String> values, String what, String fixtureName) {
        if (values.isEmpty()) {
            throw new ConfigurationException("no " + what + " available for fixture " + fixtureName);
        }
        return values.get(0);
    }

    private static String join(String... parts) {
        return String.join(NAME_SEPARATOR, parts);
    }

    @Override
    public String toString() {
        return "FixtureRegistry" + entries();
    }

    /**
     * One scoped fixture instance.
     */
    public record Entry(TestClass<?> test, String name, FixtureBinding binding) {
        public Entry {
            Objects.requireNonNull(test, "test");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(binding, "binding");
        }
    }
}
