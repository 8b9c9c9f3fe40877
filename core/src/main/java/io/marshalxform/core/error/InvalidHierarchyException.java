package io.marshalxform.core.error;

/** Thrown when a definition's parents cannot be linearized into a consistent precedence order. */
public final class InvalidHierarchyException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public InvalidHierarchyException(String message, String schemaName) {
        super(message, schemaName, null);
    }
}
