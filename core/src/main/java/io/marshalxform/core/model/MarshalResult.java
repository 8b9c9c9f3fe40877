package io.marshalxform.core.model;

import java.util.Map;

/** Outcome of {@code Schema.dump} and {@code Schema.dumps}. */
public final class MarshalResult extends SchemaResult {

    private MarshalResult(Object data, Map<Object, Object> errors) {
        super(data, errors);
    }

    /**
     * Creates a result holding {@code data} and the collected errors.
     *
     * @param data   the dumped map, list of maps, or encoded bytes
     * @param errors the error mapping, may be empty or null
     */
    public static MarshalResult of(Object data, Map<Object, Object> errors) {
        return new MarshalResult(data, errors);
    }

    @Override
    public String toString() {
        return "MarshalResult[" + (hasErrors() ? "errors=" + errors() : "OK") + "]";
    }
}
