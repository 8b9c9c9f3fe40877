package io.marshalxform.core.error;

/** Thrown when a nested field refers to a schema name or type that is not registered. */
public final class UnknownSchemaException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public UnknownSchemaException(String message, String schemaName, String fieldName) {
        super(message, schemaName, fieldName);
    }
}
