package io.marshalxform.core.error;

/**
 * Thrown when a YAML schema definition file has invalid syntax, unknown keys, or references that
 * cannot be resolved. Carries the file or resource the definition was read from.
 */
public final class SchemaParseException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaParseException(String message, String schemaName, String source) {
        super(message, schemaName, null);
        this.source = source;
    }

    public SchemaParseException(String message, Throwable cause, String schemaName, String source) {
        super(message, cause, schemaName, null);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
