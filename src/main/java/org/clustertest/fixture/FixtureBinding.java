package org.clustertest.fixture;

import java.util.List;
import java.util.Objects;

/**
 * Construction arguments of one scoped fixture instance.
 *
 * @param variantId variant of the fixture class to instantiate
 * @param environs programming environments inherited from the requesting test
 * @param partitions partition full names inherited from the requesting test
 */
public record FixtureBinding(int variantId, List<String> environs, List<String> partitions) {
    public FixtureBinding {
        if (variantId < 0) {
            throw new IllegalArgumentException("variantId must be >= 0");
        }
        environs = List.copyOf(Objects.requireNonNull(environs, "environs"));
        partitions = List.copyOf(Objects.requireNonNull(partitions, "partitions"));
    }
}
