package org.clustertest.hook;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.clustertest.core.RegistrationException;
import org.clustertest.core.RegressionTest;

/**
 * Pipeline hook backed by a test method.
 *
 * <p>Hooks are identified by method name: two hooks with the same name are equal, which is how
 * a subclass method overrides the base class hook it shadows.
 */
public final class Hook {
    private final String name;
    private final Method method;
    private final boolean resolvesDependencies;
    private final List<String> dependencyNames;

    private Hook(Method method, boolean resolvesDependencies, List<String> dependencyNames) {
        this.name = method.getName();
        this.method = method;
        this.resolvesDependencies = resolvesDependencies;
        this.dependencyNames = List.copyOf(dependencyNames);
    }

    static Hook of(Method method) {
        Objects.requireNonNull(method, "method");
        if (Modifier.isStatic(method.getModifiers())) {
            throw new RegistrationException("hook '" + describe(method) + "' must not be static");
        }
        boolean resolvesDependencies = method.isAnnotationPresent(RequireDeps.class);
        if (!resolvesDependencies) {
            if (method.getParameterCount() != 0) {
                throw new RegistrationException(
                    "hook '" + describe(method) + "' must not declare parameters unless it is annotated with @"
                        + RequireDeps.class.getSimpleName()
                );
            }
            return new Hook(method, false, List.of());
        }
        List<String> names = new ArrayList<>(method.getParameterCount());
        for (Parameter parameter : method.getParameters()) {
            if (parameter.getType() != DependencyLookup.class) {
                throw new RegistrationException(
                    "parameter '" + parameter.getName() + "' of hook '" + describe(method) + "' must be a "
                        + DependencyLookup.class.getSimpleName()
                );
            }
            names.add(dependencyName(method, parameter));
        }
        return new Hook(method, true, names);
    }

    public String name() {
        return name;
    }

    public Method method() {
        return method;
    }

    public Class<?> declaringClass() {
        return method.getDeclaringClass();
    }

    public boolean resolvesDependencies() {
        return resolvesDependencies;
    }

    public List<String> dependencyNames() {
        return dependencyNames;
    }

    /**
     * Invokes the hook on {@code test}, looking the method up by name on the test's runtime class
     * so that an override in a subclass is the one that runs.
     */
    public void invoke(RegressionTest test) {
        Objects.requireNonNull(test, "test");
        Method target = resolve(test.getClass());
        Object[] arguments = new Object[dependencyNames.size()];
        for (int i = 0; i < arguments.length; i++) {
            String dependency = dependencyNames.get(i);
            arguments[i] = (DependencyLookup) environ -> test.getDependency(dependency, environ);
        }
        try {
            target.setAccessible(true);
            target.invoke(test, arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new HookExecutionException(name, "hook '" + name + "' of test " + test.name() + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new HookExecutionException(name, "hook '" + name + "' is not accessible", e);
        }
    }

    private Method resolve(Class<?> runtimeClass) {
        Class<?>[] parameterTypes = method.getParameterTypes();
        for (Class<?> type = runtimeClass; type != null; type = type.getSuperclass()) {
            try {
                return type.getDeclaredMethod(name, parameterTypes);
            } catch (NoSuchMethodException ignored) {
                // keep walking up the hierarchy
            }
        }
        return method;
    }

    private static String dependencyName(Method method, Parameter parameter) {
        DependencyName annotation = parameter.getAnnotation(DependencyName.class);
        if (annotation != null) {
            String value = annotation.value() == null ? "" : annotation.value().trim();
            if (value.isEmpty()) {
                throw new RegistrationException("dependency name of hook '" + describe(method) + "' must not be blank");
            }
            return value;
        }
        if (!parameter.isNamePresent()) {
            throw new RegistrationException(
                "hook '" + describe(method) + "' needs @" + DependencyName.class.getSimpleName()
                    + " on its parameters or compilation with -parameters"
            );
        }
        return parameter.getName();
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Hook other)) {
            return false;
        }
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Hook{" + describe(method) + (dependencyNames.isEmpty() ? "" : " deps=" + dependencyNames) + "}";
    }
}
