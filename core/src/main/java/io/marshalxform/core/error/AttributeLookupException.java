package io.marshalxform.core.error;

/**
 * Thrown on dump when a pass-through field (one listed by the {@code fields} or {@code additional}
 * option without a declaration) is absent from the source object. Such fields carry no type
 * information, so there is no default to fall back on.
 */
public final class AttributeLookupException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    public AttributeLookupException(String message, String schemaName, String fieldName) {
        super(message, schemaName, fieldName);
    }
}
