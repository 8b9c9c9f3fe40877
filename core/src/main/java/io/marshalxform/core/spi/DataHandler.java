package io.marshalxform.core.spi;

import io.marshalxform.core.schema.Schema;
import java.util.Map;

/**
 * Post-processes each dumped record, e.g. to add a computed key or nest the record under a root
 * key. Handlers run in registration order, each receiving the previous handler's output.
 */
@FunctionalInterface
public interface DataHandler {

    /**
     * @param schema   the schema instance performing the dump
     * @param data     the record assembled so far
     * @param original the source object the record was dumped from
     * @return the record to pass on
     */
    Map<String, Object> handle(Schema schema, Map<String, Object> data, Object original);
}
