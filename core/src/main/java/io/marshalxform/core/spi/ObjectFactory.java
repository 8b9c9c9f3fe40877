package io.marshalxform.core.spi;

import java.util.Map;

/**
 * Builds a typed object from the fields a successful {@code load} produced. Without a factory,
 * load yields the plain mapping.
 */
@FunctionalInterface
public interface ObjectFactory {

    Object construct(Map<String, Object> fields);
}
