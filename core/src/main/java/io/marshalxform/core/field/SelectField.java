package io.marshalxform.core.field;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/** Field restricted to a fixed set of choices, checked in both directions. */
public class SelectField extends Field {

    private final List<Object> choices;

    public SelectField(Object... choices) {
        this(Arrays.asList(choices));
    }

    public SelectField(Collection<?> choices) {
        if (choices.isEmpty()) {
            throw new IllegalArgumentException("choices must not be empty");
        }
        this.choices = Collections.unmodifiableList(new ArrayList<>(choices));
    }

    public List<Object> choices() {
        return choices;
    }

    @Override
    public String kind() {
        return "select";
    }

    @Override
    protected Object format(Object value) {
        if (!choices.contains(value)) {
            throw dumpError(quoted(value) + " is not a valid choice for this field.");
        }
        return value;
    }

    @Override
    protected Object convert(Object value) {
        if (!choices.contains(value)) {
            throw loadError(quoted(value) + " is not a valid choice for this field.");
        }
        return value;
    }
}
