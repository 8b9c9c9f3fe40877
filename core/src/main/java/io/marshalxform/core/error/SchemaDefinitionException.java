package io.marshalxform.core.error;

/**
 * Abstract parent for structural errors in a schema declaration. These indicate programmer error,
 * not bad data, so they are always raised and never collected into a result's error mapping.
 * Carries the offending field name where one is known.
 */
public abstract class SchemaDefinitionException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    protected SchemaDefinitionException(String message, String schemaName, String fieldName) {
        super(message, schemaName, Phase.DEFINITION);
        this.fieldName = fieldName;
    }

    protected SchemaDefinitionException(String message, Throwable cause, String schemaName, String fieldName) {
        super(message, cause, schemaName, Phase.DEFINITION);
        this.fieldName = fieldName;
    }

    /** The field the error refers to, or {@code null} if it concerns the schema as a whole. */
    public String fieldName() {
        return fieldName;
    }
}
