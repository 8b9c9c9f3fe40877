package io.marshalxform.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when a single field value cannot be coerced to or from its representation, or fails a
 * field-level validator. A nested field reports the embedded schema's whole error mapping through
 * {@link #nestedErrors()}.
 */
public final class ConversionException extends SchemaDataException {

    private static final long serialVersionUID = 1L;

    private final Map<Object, Object> nestedErrors;

    public ConversionException(String message, String schemaName, String fieldName, Phase phase) {
        this(List.of(message), schemaName, fieldName, phase);
    }

    public ConversionException(List<String> messages, String schemaName, String fieldName, Phase phase) {
        super(messages, schemaName, fieldName, phase);
        this.nestedErrors = null;
    }

    public ConversionException(
            String message, Throwable cause, String schemaName, String fieldName, Phase phase) {
        super(List.of(message), cause, schemaName, fieldName, phase);
        this.nestedErrors = null;
    }

    public ConversionException(Map<Object, Object> nestedErrors, String schemaName, String fieldName, Phase phase) {
        super(List.of("Invalid nested data for field '" + fieldName + "': " + nestedErrors), schemaName, fieldName, phase);
        this.nestedErrors = Collections.unmodifiableMap(new LinkedHashMap<>(nestedErrors));
    }

    /** Returns {@code true} if this error wraps an embedded schema's error mapping. */
    public boolean isNested() {
        return nestedErrors != null;
    }

    /** The embedded schema's error mapping, or {@code null} for a plain conversion error. */
    public Map<Object, Object> nestedErrors() {
        return nestedErrors;
    }
}
