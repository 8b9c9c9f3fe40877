package io.marshalxform.core.spi;

import io.marshalxform.core.schema.Schema;
import java.util.Map;

/**
 * Rewrites raw input before typed conversion on {@code load}. Receives a mutable copy of the input,
 * never the caller's own map.
 */
@FunctionalInterface
public interface Preprocessor {

    /** Returns the (possibly same, possibly new) mapping to convert. */
    Map<String, Object> process(Schema schema, Map<String, Object> data);
}
