package io.marshalxform.core.error;

/** Thrown when {@code only} names a field the schema does not declare. */
public final class UnknownFieldException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public UnknownFieldException(String message, String schemaName, String fieldName) {
        super(message, schemaName, fieldName);
    }
}
