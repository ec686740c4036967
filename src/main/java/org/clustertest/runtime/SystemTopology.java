package org.clustertest.runtime;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Partitions and programming environments of the system the framework runs on.
 */
public record SystemTopology(String name, List<SystemPartition> partitions) {
    public SystemTopology {
        name = TopologyText.requireText(name, "system name");
        partitions = List.copyOf(Objects.requireNonNull(partitions, "partitions"));
    }

    public List<String> partitionFullNames() {
        List<String> names = new ArrayList<>(partitions.size());
        for (SystemPartition partition : partitions) {
            names.add(partition.fullName());
        }
        return List.copyOf(names);
    }

    /**
     * Union of environment names over all partitions, in first-seen order.
     */
    public List<String> environNames() {
        Set<String> names = new LinkedHashSet<>();
        for (SystemPartition partition : partitions) {
            for (ProgEnvironment environ : partition.environs()) {
                names.add(environ.name());
            }
        }
        return List.copyOf(names);
    }
}
