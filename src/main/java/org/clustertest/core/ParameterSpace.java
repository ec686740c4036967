package org.clustertest.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered parameter declarations visible to a test class, own declarations overriding the
 * superclass's.
 */
public final class ParameterSpace {
    private static final ClassValue<ParameterSpace> SPACES = new ClassValue<>() {
        @Override
        protected ParameterSpace computeValue(final Class<?> type) {
            return build(type);
        }
    };

    private final Map<String, List<String>> parameters;
    private final int size;

    private ParameterSpace(final Map<String, List<String>> parameters) {
        this.parameters = Collections.unmodifiableMap(parameters);
        int product = 1;
        for (final List<String> values : parameters.values()) {
            product = Math.multiplyExact(product, Math.max(1, values.size()));
        }
        this.size = product;
    }

    public static ParameterSpace forClass(final Class<?> type) {
        return SPACES.get(Objects.requireNonNull(type, "type"));
    }

    public Map<String, List<String>> parameters() {
        return parameters;
    }

    /**
     * Number of value combinations; a space without parameters has exactly one.
     */
    public int size() {
        return size;
    }

    public boolean hasUndefinedParameters() {
        for (final List<String> values : parameters.values()) {
            if (values.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parameter values of one combination; the last declared parameter varies fastest.
     */
    public Map<String, String> valuesAt(final int index) {
        if (index < 0 || index >= size) {
            throw new ConfigurationException("parameter index out of range: " + index);
        }
        if (hasUndefinedParameters()) {
            throw new ConfigurationException("parameter space has undefined parameters");
        }
        final List<String> names = new ArrayList<>(parameters.keySet());
        final String[] selected = new String[names.size()];
        int remainder = index;
        for (int i = names.size() - 1; i >= 0; i--) {
            final List<String> values = parameters.get(names.get(i));
            selected[i] = values.get(remainder % values.size());
            remainder /= values.size();
        }
        final Map<String, String> combination = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            combination.put(names.get(i), selected[i]);
        }
        return Collections.unmodifiableMap(combination);
    }

    private static ParameterSpace build(final Class<?> type) {
        final Map<String, List<String>> merged = new LinkedHashMap<>();
        final Class<?> superclass = type.getSuperclass();
        if (superclass != null && superclass != Object.class) {
            merged.putAll(forClass(superclass).parameters);
        }
        final Map<String, List<String>> own = new LinkedHashMap<>();
        for (final Parameter parameter : type.getDeclaredAnnotationsByType(Parameter.class)) {
            final String name = parameter.name() == null ? "" : parameter.name().trim();
            if (name.isEmpty()) {
                throw new RegistrationException("parameter name must not be blank in " + type.getName());
            }
            if (own.containsKey(name)) {
                throw new RegistrationException(
                        "parameter '" + name + "' is declared more than once in " + type.getName());
            }
            own.put(name, List.of(parameter.values()));
        }
        merged.putAll(own);
        return new ParameterSpace(merged);
    }
}
