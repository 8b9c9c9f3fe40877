package io.marshalxform.core.error;

import java.util.Map;

/** Raised by a strict schema when {@code load} hits a field or schema-level error. */
public final class UnmarshallingException extends StrictModeException {

    private static final long serialVersionUID = 1L;

    public UnmarshallingException(String message, Throwable cause, String schemaName, Map<Object, Object> errors) {
        super(message, cause, schemaName, Phase.LOAD, errors);
    }
}
