package io.marshalxform.core.error;

/**
 * Thrown when a schema that is not in many-mode is handed a raw sequence. Iterating silently would
 * fan out by accident, so the caller must ask for {@code many} explicitly.
 */
public final class ImplicitCollectionException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public ImplicitCollectionException(String message, String schemaName, String fieldName) {
        super(message, schemaName, fieldName);
    }
}
