package io.marshalxform.core.engine;

import io.marshalxform.core.error.SchemaDataException;
import io.marshalxform.core.error.SchemaException.Phase;
import io.marshalxform.core.error.ValidationException;
import io.marshalxform.core.field.Field;
import io.marshalxform.core.model.Missing;
import io.marshalxform.core.model.UnmarshalResult;
import io.marshalxform.core.schema.Schema;
import io.marshalxform.core.spi.ErrorHandler;
import io.marshalxform.core.spi.ObjectFactory;
import io.marshalxform.core.spi.Preprocessor;
import io.marshalxform.core.spi.SchemaValidator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Load engine: input mapping(s) to converted fields or typed objects.
 *
 * <p>For each record the preprocessors rewrite a copy of the input, every bound field that is not
 * dump-only is deserialized from the key of its name and stored under its attribute, and the
 * schema validators then check the converted fields as a whole. A record without errors is handed
 * to the object factory when one is registered; otherwise the converted fields are returned, with
 * failing fields left out.
 */
public final class Unmarshaller {

    private static final String INVALID_INPUT = "Invalid input type.";

    private Unmarshaller() {}

    public static UnmarshalResult load(Schema schema, Object input) {
        ErrorCollector collector = ErrorCollector.forCall(schema, Phase.LOAD);
        Object data;
        if (schema.isMany()) {
            data = loadMany(schema, input, collector);
        } else {
            data = loadRecord(schema, input, collector);
        }
        ErrorHandler handler = schema.errorHandler();
        if (handler != null && collector.hasErrors()) {
            handler.handle(schema, collector.errors(), input);
        }
        return UnmarshalResult.of(data, collector.errors());
    }

    private static List<Object> loadMany(Schema schema, Object input, ErrorCollector collector) {
        List<Object> records = new ArrayList<>();
        if (!Sequences.isSequence(input)) {
            collector.schemaError(new ValidationException(INVALID_INPUT));
            return records;
        }
        Iterator<?> elements = Sequences.iterator(input);
        int index = 0;
        while (elements.hasNext()) {
            records.add(loadRecord(schema, elements.next(), collector.forItem(index)));
            index++;
        }
        return records;
    }

    private static Object loadRecord(Schema schema, Object input, ErrorCollector collector) {
        if (!(input instanceof Map)) {
            collector.schemaError(new ValidationException(INVALID_INPUT));
            return new LinkedHashMap<String, Object>();
        }
        Map<String, Object> working = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) input).entrySet()) {
            working.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        for (Preprocessor preprocessor : schema.preprocessors()) {
            Map<String, Object> processed = preprocessor.process(schema, working);
            if (processed == null) {
                throw new IllegalStateException("Preprocessor " + preprocessor + " returned null");
            }
            working = processed;
        }

        Map<String, Object> converted = new LinkedHashMap<>();
        for (Field field : schema.fields().values()) {
            if (field.isDumpOnly()) {
                continue;
            }
            Object raw = working.containsKey(field.name()) ? working.get(field.name()) : Missing.VALUE;
            try {
                Object value = field.deserialize(raw);
                if (!Missing.isMissing(value)) {
                    converted.put(field.key(), value);
                }
            } catch (SchemaDataException e) {
                collector.fieldError(field.name(), e);
            }
        }

        Map<String, Object> view = Collections.unmodifiableMap(converted);
        for (SchemaValidator validator : schema.validators()) {
            try {
                if (!validator.validate(schema, view)) {
                    collector.schemaError(new ValidationException("Schema validator " + validator.name() + " is false."));
                }
            } catch (ValidationException e) {
                if (e.fieldName() != null) {
                    collector.fieldError(e.fieldName(), e);
                } else {
                    collector.schemaError(e);
                }
            }
        }

        ObjectFactory factory = schema.objectFactory();
        if (factory != null && !collector.recordHasErrors()) {
            return factory.construct(converted);
        }
        return converted;
    }
}
