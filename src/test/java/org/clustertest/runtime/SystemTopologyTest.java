package org.clustertest.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class SystemTopologyTest {
    @Test
    void qualifiesPartitionNamesWithTheSystemName() {
        SystemPartition partition = SystemPartition.of("daint", "gpu", "gnu", "cray");

        assertEquals("gpu", partition.name());
        assertEquals("daint:gpu", partition.fullName());
        assertEquals(List.of(new ProgEnvironment("gnu"), new ProgEnvironment("cray")), partition.environs());
    }

    @Test
    void unionsEnvironmentsInFirstSeenOrder() {
        SystemTopology topology = new SystemTopology(
            "daint",
            List.of(
                SystemPartition.of("daint", "gpu", "gnu", "cray"),
                SystemPartition.of("daint", "mc", "intel", "gnu")
            )
        );

        assertEquals(List.of("daint:gpu", "daint:mc"), topology.partitionFullNames());
        assertEquals(List.of("gnu", "cray", "intel"), topology.environNames());
    }

    @Test
    void runtimeExposesTheTopology() {
        SystemTopology topology = new SystemTopology("daint", List.of());

        assertSame(topology, TestRuntime.of(topology).system());
    }

    @Test
    void rejectsBlankNames() {
        assertThrows(IllegalArgumentException.class, () -> new ProgEnvironment(" "));
        assertThrows(IllegalArgumentException.class, () -> new SystemTopology("", List.of()));
        assertThrows(IllegalArgumentException.class, () -> SystemPartition.of("daint", null));
    }
}
