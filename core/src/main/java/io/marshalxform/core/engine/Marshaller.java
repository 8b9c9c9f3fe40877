package io.marshalxform.core.engine;

import io.marshalxform.core.error.ImplicitCollectionException;
import io.marshalxform.core.error.SchemaDataException;
import io.marshalxform.core.error.SchemaException.Phase;
import io.marshalxform.core.error.ValidationException;
import io.marshalxform.core.field.Field;
import io.marshalxform.core.model.MarshalResult;
import io.marshalxform.core.model.Missing;
import io.marshalxform.core.schema.Schema;
import io.marshalxform.core.spi.DataHandler;
import io.marshalxform.core.spi.ErrorHandler;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dump engine: object(s) to ordered mapping(s).
 *
 * <p>For each record, every bound field is serialized in order; a failing field is left out of the
 * record and its error recorded, without stopping the other fields. The record then passes through
 * the schema's data handlers in order, and the {@code extra} entries are overlaid last. In
 * many-mode each element of the input is dumped independently and errors are keyed by index.
 */
public final class Marshaller {

    private static final Logger LOG = LoggerFactory.getLogger(Marshaller.class);

    private Marshaller() {}

    /**
     * Dumps {@code source} with {@code schema}.
     *
     * @throws ImplicitCollectionException if a single-record schema is given a sequence
     */
    public static MarshalResult dump(Schema schema, Object source) {
        ErrorCollector collector = ErrorCollector.forCall(schema, Phase.DUMP);
        Object data;
        if (schema.isMany()) {
            data = dumpMany(schema, source, collector);
        } else {
            if (Sequences.isSequence(source)) {
                LOG.warn(
                        "Schema {} was given a {} without many=true; implicit collection handling is not supported",
                        schema.name(),
                        source.getClass().getSimpleName());
                throw new ImplicitCollectionException(
                        "Schema " + schema.name() + " received a sequence; create it with many=true to dump collections",
                        schema.name(),
                        null);
            }
            data = dumpOne(schema, source, collector);
        }
        ErrorHandler handler = schema.errorHandler();
        if (handler != null && collector.hasErrors()) {
            handler.handle(schema, collector.errors(), source);
        }
        return MarshalResult.of(data, collector.errors());
    }

    private static List<Object> dumpMany(Schema schema, Object source, ErrorCollector collector) {
        List<Object> records = new ArrayList<>();
        if (source == null) {
            return records;
        }
        if (!Sequences.isSequence(source)) {
            collector.schemaError(new ValidationException("Invalid input type."));
            return records;
        }
        Iterator<?> elements = Sequences.iterator(source);
        int index = 0;
        while (elements.hasNext()) {
            records.add(dumpOne(schema, elements.next(), collector.forItem(index)));
            index++;
        }
        return records;
    }

    private static Map<String, Object> dumpOne(Schema schema, Object source, ErrorCollector collector) {
        boolean skipMissing = schema.options().skipMissing();
        String prefix = schema.prefix();
        Map<String, Object> record = new LinkedHashMap<>();
        for (Field field : schema.fields().values()) {
            try {
                Object value;
                if (skipMissing && !field.isDumpOnly()) {
                    Object raw = field.getValue(source);
                    if (Missing.isMissingOrNull(raw)) {
                        continue;
                    }
                    value = field.serializeValue(raw);
                } else {
                    value = field.serialize(source);
                }
                record.put(prefix + field.name(), value);
            } catch (SchemaDataException e) {
                collector.fieldError(field.name(), e);
            }
        }
        Map<String, Object> data = record;
        for (DataHandler handler : schema.dataHandlers()) {
            try {
                Map<String, Object> handled = handler.handle(schema, data, source);
                if (handled == null) {
                    throw new IllegalStateException("Data handler " + handler + " returned null");
                }
                data = handled;
            } catch (SchemaDataException e) {
                collector.schemaError(e);
            }
        }
        if (schema.extra() != null) {
            data = new LinkedHashMap<>(data);
            data.putAll(schema.extra());
        }
        return data;
    }
}
