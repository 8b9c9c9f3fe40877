package io.marshalxform.core.error;

import java.util.List;

/**
 * Abstract parent for per-record data errors raised while converting or validating a single value.
 * The engines catch these and collect them into the result's error mapping; they only reach the
 * caller wrapped in a {@link StrictModeException} when the schema is strict.
 */
public abstract class SchemaDataException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final List<String> messages;

    protected SchemaDataException(List<String> messages, String schemaName, String fieldName, Phase phase) {
        super(String.join(" ", messages), schemaName, phase);
        this.fieldName = fieldName;
        this.messages = List.copyOf(messages);
    }

    protected SchemaDataException(
            List<String> messages, Throwable cause, String schemaName, String fieldName, Phase phase) {
        super(String.join(" ", messages), cause, schemaName, phase);
        this.fieldName = fieldName;
        this.messages = List.copyOf(messages);
    }

    /** The field the error belongs to, or {@code null} for schema-level errors. */
    public String fieldName() {
        return fieldName;
    }

    /** The individual human-readable messages, in the order they were produced. */
    public List<String> messages() {
        return messages;
    }
}
