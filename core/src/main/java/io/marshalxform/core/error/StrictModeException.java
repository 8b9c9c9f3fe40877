package io.marshalxform.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Abstract parent for the exceptions a strict schema raises instead of collecting errors. Wraps the
 * first underlying error as its cause and carries the errors accumulated up to that point.
 */
public abstract class StrictModeException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final transient Map<Object, Object> errors;

    protected StrictModeException(
            String message, Throwable cause, String schemaName, Phase phase, Map<Object, Object> errors) {
        super(message, cause, schemaName, phase);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /** The errors accumulated before the schema gave up. */
    public Map<Object, Object> errors() {
        return errors;
    }

    /** The error that triggered the raise (alias for {@link #getCause()}). */
    public Throwable underlyingException() {
        return getCause();
    }
}
