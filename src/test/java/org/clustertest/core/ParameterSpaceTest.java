package org.clustertest.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParameterSpaceTest {
    @Test
    void lastParameterVariesFastest() {
        ParameterSpace space = ParameterSpace.forClass(Matrix.class);

        assertEquals(6, space.size());
        assertEquals(Map.of("size", "small", "mode", "a"), space.valuesAt(0));
        assertEquals(Map.of("size", "small", "mode", "b"), space.valuesAt(1));
        assertEquals(Map.of("size", "large", "mode", "a"), space.valuesAt(3));
        assertEquals(List.of("size", "mode"), List.copyOf(space.parameters().keySet()));
    }

    @Test
    void subclassRedefinesInheritedParameters() {
        ParameterSpace base = ParameterSpace.forClass(Unbound.class);
        ParameterSpace bound = ParameterSpace.forClass(Bound.class);

        assertTrue(base.hasUndefinedParameters());
        assertEquals(1, base.size());
        assertFalse(bound.hasUndefinedParameters());
        assertEquals(List.of("x", "y"), bound.parameters().get("arch"));
    }

    @Test
    void emptySpaceHasOneCombination() {
        ParameterSpace space = ParameterSpace.forClass(Plain.class);

        assertEquals(1, space.size());
        assertEquals(Map.of(), space.valuesAt(0));
    }

    @Test
    void rejectsOutOfRangeAndUndefinedAccess() {
        assertThrows(ConfigurationException.class, () -> ParameterSpace.forClass(Matrix.class).valuesAt(6));
        assertThrows(ConfigurationException.class, () -> ParameterSpace.forClass(Unbound.class).valuesAt(0));
    }

    @Test
    void rejectsDuplicateDeclarations() {
        RegistrationException error =
            assertThrows(RegistrationException.class, () -> ParameterSpace.forClass(Duplicated.class));

        assertTrue(error.getMessage().contains("'size'"));
    }

    @Parameter(name = "size", values = {"small", "medium", "large"})
    @Parameter(name = "mode", values = {"a", "b"})
    private static final class Matrix {
    }

    @Parameter(name = "arch")
    private static class Unbound {
    }

    @Parameter(name = "arch", values = {"x", "y"})
    private static final class Bound extends Unbound {
    }

    private static final class Plain {
    }

    @Parameter(name = "size", values = "1")
    @Parameter(name = "size", values = "2")
    private static final class Duplicated {
    }
}
