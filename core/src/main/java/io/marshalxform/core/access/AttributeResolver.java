package io.marshalxform.core.access;

import io.marshalxform.core.model.Missing;
import io.marshalxform.core.spi.AttributeAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves possibly dotted attribute paths ({@code "user.name"}) against a source value. Each path
 * segment is read by the first accessor whose {@link AttributeAccessor#canAccess(Object)} accepts
 * the current value. A {@code null} intermediate value ends the walk with {@code null}; a segment
 * that does not exist ends it with {@link Missing#VALUE}.
 *
 * <p>Immutable and thread-safe.
 */
public final class AttributeResolver {

    private static final AttributeResolver STANDARD =
            new AttributeResolver(List.of(MapAttributeAccessor.INSTANCE, BeanAttributeAccessor.INSTANCE));

    private final List<AttributeAccessor> accessors;

    private AttributeResolver(List<AttributeAccessor> accessors) {
        this.accessors = List.copyOf(accessors);
    }

    /** Map and bean access, in that order. */
    public static AttributeResolver standard() {
        return STANDARD;
    }

    /**
     * Returns a resolver that consults {@code custom} before the accessors of this resolver.
     *
     * @param custom accessors to try first, in order
     * @return a new resolver, or this one if {@code custom} is empty
     */
    public AttributeResolver withPrepended(List<? extends AttributeAccessor> custom) {
        if (custom.isEmpty()) {
            return this;
        }
        List<AttributeAccessor> combined = new ArrayList<>(custom);
        combined.addAll(accessors);
        return new AttributeResolver(combined);
    }

    /**
     * Resolves {@code path} against {@code source}.
     *
     * @param source the object to read from, may be {@code null}
     * @param path   an attribute name or dot-separated path
     * @return the value, {@code null}, or {@link Missing#VALUE}
     */
    public Object resolve(Object source, String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (source == null) {
            return Missing.VALUE;
        }
        Object current = source;
        for (String segment : path.split("\\.", -1)) {
            if (current == null) {
                return null;
            }
            current = accessorFor(current).get(current, segment);
            if (Missing.isMissing(current)) {
                return Missing.VALUE;
            }
        }
        return current;
    }

    private AttributeAccessor accessorFor(Object value) {
        for (AttributeAccessor accessor : accessors) {
            if (accessor.canAccess(value)) {
                return accessor;
            }
        }
        throw new IllegalStateException("No attribute accessor can read " + value.getClass().getName());
    }

    /** The accessors in lookup order. */
    public List<AttributeAccessor> accessors() {
        return accessors;
    }
}
