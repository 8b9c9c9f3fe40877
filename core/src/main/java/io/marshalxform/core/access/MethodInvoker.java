package io.marshalxform.core.access;

import io.marshalxform.core.error.InvalidFieldDeclarationException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;

/**
 * Calls a named public method on a schema instance with the object being dumped, and optionally
 * the schema's context map. Accepted signatures are {@code m(Object)} and {@code m(Object, Map)};
 * the parameter types only need to accept the arguments.
 */
public final class MethodInvoker {

    private final Method method;
    private final boolean requiresContext;

    private MethodInvoker(Method method) {
        this.method = method;
        this.requiresContext = method.getParameterCount() == 2;
    }

    /**
     * Finds {@code methodName} on {@code schemaType}. A two-parameter overload is preferred over a
     * one-parameter one.
     *
     * @throws InvalidFieldDeclarationException if no suitable public method exists
     */
    public static MethodInvoker find(Class<?> schemaType, String methodName, String schemaName, String fieldName) {
        Method single = null;
        for (Method candidate : schemaType.getMethods()) {
            if (!candidate.getName().equals(methodName) || Modifier.isStatic(candidate.getModifiers())) {
                continue;
            }
            Class<?>[] params = candidate.getParameterTypes();
            if (params.length == 2 && params[1].isAssignableFrom(Map.class)) {
                return new MethodInvoker(candidate);
            }
            if (params.length == 1) {
                single = candidate;
            }
        }
        if (single == null) {
            throw new InvalidFieldDeclarationException(
                    "Schema type " + schemaType.getSimpleName() + " has no public method '" + methodName
                            + "(obj)' or '" + methodName + "(obj, context)'",
                    schemaName,
                    fieldName);
        }
        return new MethodInvoker(single);
    }

    /** Returns {@code true} if the method takes the context map as its second argument. */
    public boolean requiresContext() {
        return requiresContext;
    }

    public String methodName() {
        return method.getName();
    }

    /**
     * Invokes the method. Unchecked exceptions thrown by the method propagate unchanged.
     *
     * @param target  the schema instance
     * @param value   the object being dumped
     * @param context the context map, only passed to two-parameter methods
     */
    public Object invoke(Object target, Object value, Map<String, Object> context) {
        try {
            return requiresContext ? method.invoke(target, value, context) : method.invoke(target, value);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Method '" + method.getName() + "' failed: " + cause.getMessage(), cause);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new IllegalStateException("Cannot invoke method '" + method.getName() + "': " + e.getMessage(), e);
        }
    }
}
