package io.marshalxform.core.field;

import io.marshalxform.core.error.ConversionException;
import io.marshalxform.core.error.SchemaException.Phase;
import io.marshalxform.core.model.Missing;
import io.marshalxform.core.schema.Schema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Homogeneous list whose elements are converted by an inner field. A single non-collection value
 * is treated as a one-element list. Element errors are reported with their index; if any element
 * fails with a nested error mapping, the whole field reports a mapping keyed by index.
 */
public class ListField extends Field {

    private final Field inner;
    private Field boundInner;

    public ListField(Field inner) {
        this.inner = Objects.requireNonNull(inner, "inner field must not be null");
    }

    public Field inner() {
        return inner;
    }

    @Override
    public String kind() {
        return "list";
    }

    @Override
    protected void onBind(Schema parent) {
        boundInner = inner.bind(name(), parent);
    }

    @Override
    protected Object kindDefault() {
        return new ArrayList<>();
    }

    @Override
    protected Object format(Object value) {
        List<Object> out = new ArrayList<>();
        Map<Object, Object> errors = new LinkedHashMap<>();
        int index = 0;
        for (Object element : elements(value)) {
            try {
                out.add(itemField().serializeValue(element));
            } catch (ConversionException e) {
                errors.put(index, e.isNested() ? e.nestedErrors() : e.messages());
            }
            index++;
        }
        if (!errors.isEmpty()) {
            throw failure(errors, Phase.DUMP);
        }
        return out;
    }

    @Override
    protected Object convert(Object value) {
        List<Object> out = new ArrayList<>();
        Map<Object, Object> errors = new LinkedHashMap<>();
        int index = 0;
        for (Object element : elements(value)) {
            try {
                Object converted = itemField().deserialize(element);
                out.add(Missing.isMissing(converted) ? null : converted);
            } catch (ConversionException e) {
                errors.put(index, e.isNested() ? e.nestedErrors() : e.messages());
            }
            index++;
        }
        if (!errors.isEmpty()) {
            throw failure(errors, Phase.LOAD);
        }
        return out;
    }

    private Field itemField() {
        return boundInner != null ? boundInner : inner;
    }

    @SuppressWarnings("unchecked")
    private ConversionException failure(Map<Object, Object> errors, Phase phase) {
        boolean nested = errors.values().stream().anyMatch(v -> v instanceof Map);
        if (nested) {
            return new ConversionException(errors, schemaName(), name(), phase);
        }
        if (errorMessage() != null) {
            return phase == Phase.DUMP ? dumpError(errorMessage()) : loadError(errorMessage());
        }
        List<String> messages = new ArrayList<>();
        errors.forEach((index, list) -> {
            for (String message : (List<String>) list) {
                messages.add("[" + index + "] " + message);
            }
        });
        return new ConversionException(messages, schemaName(), name(), phase);
    }

    private static Iterable<?> elements(Object value) {
        if (value instanceof Collection) {
            return (Collection<?>) value;
        }
        if (value instanceof Iterable && !(value instanceof Map)) {
            return (Iterable<?>) value;
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        return List.of(value);
    }
}
