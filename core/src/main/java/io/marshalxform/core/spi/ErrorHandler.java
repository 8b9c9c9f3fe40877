package io.marshalxform.core.spi;

import io.marshalxform.core.schema.Schema;
import java.util.Map;

/**
 * Replaces the default strict-mode raise whenever a dump or load finishes with errors. The handler
 * may log, transform or throw; anything it throws reaches the caller unchanged. One handler may be
 * registered on several schema definitions.
 */
@FunctionalInterface
public interface ErrorHandler {

    /**
     * @param schema   the schema instance that produced the errors
     * @param errors   the error mapping
     * @param original the object passed to dump, or the input passed to load
     */
    void handle(Schema schema, Map<Object, Object> errors, Object original);
}
