package io.marshalxform.core.error;

import java.util.Map;

/** Raised by a strict schema when {@code dump} hits a data error. */
public final class MarshallingException extends StrictModeException {

    private static final long serialVersionUID = 1L;

    public MarshallingException(String message, Throwable cause, String schemaName, Map<Object, Object> errors) {
        super(message, cause, schemaName, Phase.DUMP, errors);
    }
}
