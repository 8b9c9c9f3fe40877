package io.marshalxform.core.field;

import java.util.Collection;
import java.util.Map;

/** Text field. Dumps any value through {@code toString()}; loads scalars only. */
public class StringField extends Field {

    @Override
    public String kind() {
        return "string";
    }

    @Override
    protected Object kindDefault() {
        return "";
    }

    @Override
    protected Object format(Object value) {
        return value.toString();
    }

    @Override
    protected Object convert(Object value) {
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            throw loadError(quoted(value) + " is not a valid string.");
        }
        return value.toString();
    }
}
