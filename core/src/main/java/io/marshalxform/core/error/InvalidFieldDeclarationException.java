package io.marshalxform.core.error;

/**
 * Thrown when a field declaration cannot be used: a value that is not a field instance, a nested
 * field pointing at a type that is not a schema, or a method field naming a method the schema does
 * not have.
 */
public final class InvalidFieldDeclarationException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public InvalidFieldDeclarationException(String message, String schemaName, String fieldName) {
        super(message, schemaName, fieldName);
    }

    public InvalidFieldDeclarationException(String message, Throwable cause, String schemaName, String fieldName) {
        super(message, cause, schemaName, fieldName);
    }
}
