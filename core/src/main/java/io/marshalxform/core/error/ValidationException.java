package io.marshalxform.core.error;

import java.util.List;

/**
 * Raised by user-supplied validators to reject a value with a custom message. Schema-level
 * validators may name a field to attach the message to instead of the reserved schema key.
 */
public final class ValidationException extends SchemaDataException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(List.of(message), null, null, Phase.LOAD);
    }

    public ValidationException(String message, String fieldName) {
        super(List.of(message), null, fieldName, Phase.LOAD);
    }
}
