package io.marshalxform.core.access;

import io.marshalxform.core.model.Missing;
import io.marshalxform.core.spi.AttributeAccessor;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads attributes from arbitrary objects by reflection. For an attribute {@code name} the lookup
 * order is:
 *
 * <ol>
 *   <li>a public no-arg method called {@code name} (record components, fluent accessors)
 *   <li>a public no-arg {@code getName()} method
 *   <li>a public no-arg {@code isName()} method
 *   <li>an instance field called {@code name}, anywhere in the class hierarchy
 * </ol>
 *
 * <p>Resolved members are cached per class. Thread-safe.
 */
public final class BeanAttributeAccessor implements AttributeAccessor {

    public static final BeanAttributeAccessor INSTANCE = new BeanAttributeAccessor();

    private final Map<Class<?>, Map<String, Optional<Member>>> cache = new ConcurrentHashMap<>();

    private BeanAttributeAccessor() {}

    @Override
    public boolean canAccess(Object source) {
        return source != null;
    }

    @Override
    public Object get(Object source, String name) {
        Optional<Member> member = cache.computeIfAbsent(source.getClass(), c -> new ConcurrentHashMap<>())
                .computeIfAbsent(name, n -> resolve(source.getClass(), n));
        // a present member may read null, which is not the same as missing
        return member.isPresent() ? member.get().read(source) : Missing.VALUE;
    }

    private static Optional<Member> resolve(Class<?> type, String name) {
        String capitalized = name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String candidate : new String[] {name, "get" + capitalized, "is" + capitalized}) {
            Method method = findAccessor(type, candidate);
            if (method != null) {
                return Optional.of(new Member(method));
            }
        }
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            try {
                Field field = c.getDeclaredField(name);
                if (!Modifier.isStatic(field.getModifiers()) && trySetAccessible(field)) {
                    return Optional.of(new Member(field));
                }
            } catch (NoSuchFieldException e) {
                // keep walking up the hierarchy
            }
        }
        return Optional.empty();
    }

    private static Method findAccessor(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            if (Modifier.isStatic(method.getModifiers())
                    || method.getReturnType() == void.class
                    || method.getDeclaringClass() == Object.class) {
                return null;
            }
            return trySetAccessible(method) ? method : null;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static boolean trySetAccessible(AccessibleObject member) {
        try {
            return member.trySetAccessible();
        } catch (SecurityException e) {
            return false;
        }
    }

    /** A resolved method or field. */
    private static final class Member {

        private final Method method;
        private final Field field;

        Member(Method method) {
            this.method = method;
            this.field = null;
        }

        Member(Field field) {
            this.method = null;
            this.field = field;
        }

        Object read(Object source) {
            try {
                return method != null ? method.invoke(source) : field.get(source);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Accessor failed: " + cause.getMessage(), cause);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Accessor is not accessible: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "BeanAttributeAccessor";
    }
}
