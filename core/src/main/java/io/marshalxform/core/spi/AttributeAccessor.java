package io.marshalxform.core.spi;

/**
 * Capability for reading one named attribute out of a source value. The engine selects an accessor
 * by asking {@link #canAccess(Object)}, never by the source's concrete type, so maps, beans and
 * custom host objects are handled uniformly.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface AttributeAccessor {

    /**
     * Returns {@code true} if this accessor knows how to read attributes from {@code source}.
     *
     * @param source a non-null source value
     */
    boolean canAccess(Object source);

    /**
     * Reads a single (undotted) attribute.
     *
     * @param source a non-null source value accepted by {@link #canAccess(Object)}
     * @param name   the attribute or key name
     * @return the value, which may be {@code null}, or {@link io.marshalxform.core.model.Missing#VALUE}
     *     if the attribute does not exist
     */
    Object get(Object source, String name);
}
