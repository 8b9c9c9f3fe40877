package io.marshalxform.core.spi;

import io.marshalxform.core.schema.Schema;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-field validator run by {@code load} after every field has been converted. Returning {@code
 * false} records a generic schema-level message; throwing {@link
 * io.marshalxform.core.error.ValidationException} records its own message, optionally against a
 * specific field.
 */
@FunctionalInterface
public interface SchemaValidator {

    /**
     * @param schema the schema instance performing the load
     * @param data   the successfully converted fields, keyed by output key
     * @return {@code false} to reject the record
     */
    boolean validate(Schema schema, Map<String, Object> data);

    /** Name used in error messages. Lambdas should be wrapped with {@link #named}. */
    default String name() {
        return getClass().getSimpleName();
    }

    /** Wraps {@code validator} so that error messages refer to it as {@code name}. */
    static SchemaValidator named(String name, SchemaValidator validator) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(validator, "validator must not be null");
        return new SchemaValidator() {
            @Override
            public boolean validate(Schema schema, Map<String, Object> data) {
                return validator.validate(schema, data);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return "SchemaValidator[" + name + "]";
            }
        };
    }
}
