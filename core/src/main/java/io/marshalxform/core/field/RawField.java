package io.marshalxform.core.field;

/** Passes values through unchanged in both directions. */
public class RawField extends Field {

    @Override
    public String kind() {
        return "raw";
    }

    @Override
    protected Object format(Object value) {
        return value;
    }

    @Override
    protected Object convert(Object value) {
        return value;
    }
}
