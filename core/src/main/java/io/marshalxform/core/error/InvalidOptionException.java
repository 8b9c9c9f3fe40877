package io.marshalxform.core.error;

/**
 * Thrown when schema options are structurally invalid: {@code fields} and {@code additional} set
 * together, or a name-list option given as something other than a sequence.
 */
public final class InvalidOptionException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public InvalidOptionException(String message, String schemaName) {
        super(message, schemaName, null);
    }
}
