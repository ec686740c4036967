package org.clustertest.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partition of the current system with its programming environments.
 *
 * @param name short partition name
 * @param fullName qualified name of the form {@code system:partition}
 * @param environs programming environments in configuration order
 */
public record SystemPartition(String name, String fullName, List<ProgEnvironment> environs) {
    public SystemPartition {
        name = TopologyText.requireText(name, "partition name");
        fullName = TopologyText.requireText(fullName, "partition fullName");
        environs = List.copyOf(Objects.requireNonNull(environs, "environs"));
    }

    public static SystemPartition of(String systemName, String name, String... environNames) {
        Objects.requireNonNull(environNames, "environNames");
        List<ProgEnvironment> environs = new ArrayList<>(environNames.length);
        for (String environName : environNames) {
            environs.add(new ProgEnvironment(environName));
        }
        return new SystemPartition(name, systemName + ":" + name, environs);
    }
}
