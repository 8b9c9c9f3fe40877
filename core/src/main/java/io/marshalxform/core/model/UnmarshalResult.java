package io.marshalxform.core.model;

import java.util.Map;

/** Outcome of {@code Schema.load} and {@code Schema.loads}. */
public final class UnmarshalResult extends SchemaResult {

    private UnmarshalResult(Object data, Map<Object, Object> errors) {
        super(data, errors);
    }

    /**
     * Creates a result holding {@code data} and the collected errors.
     *
     * @param data   the loaded map, typed object, or list of either in many-mode
     * @param errors the error mapping, may be empty or null
     */
    public static UnmarshalResult of(Object data, Map<Object, Object> errors) {
        return new UnmarshalResult(data, errors);
    }

    @Override
    public String toString() {
        return "UnmarshalResult[" + (hasErrors() ? "errors=" + errors() : "OK") + "]";
    }
}
