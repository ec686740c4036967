package org.clustertest.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.clustertest.core.TestClass;

/**
 * One registered construction of a test class.
 *
 * @param testClass class to instantiate
 * @param variantNum variant to instantiate, or null for a test constructed from arguments only
 * @param arguments user arguments handed to the constructor
 */
public record TestRecipe(TestClass<?> testClass, Integer variantNum, Map<String, Object> arguments) {
    public TestRecipe {
        Objects.requireNonNull(testClass, "testClass");
        if (variantNum != null && variantNum < 0) {
            throw new IllegalArgumentException("variantNum must be >= 0");
        }
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(arguments, "arguments")));
    }

    public static TestRecipe of(TestClass<?> testClass, int variantNum) {
        return new TestRecipe(testClass, variantNum, Map.of());
    }

    public Optional<Integer> variant() {
        return Optional.ofNullable(variantNum);
    }
}
