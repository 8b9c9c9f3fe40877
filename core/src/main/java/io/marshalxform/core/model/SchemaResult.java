package io.marshalxform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Common shape of every conversion result: the (possibly partial) data plus the error mapping.
 *
 * <p>
 * In single-record mode {@link #errors()} maps a field name to a list of messages, or to a nested
 * error mapping for nested fields; schema-level errors sit under {@link #SCHEMA_ERRORS_KEY}. In
 * many-mode it maps the integer index of each failing record to that record's error mapping, and
 * records without errors are absent.
 */
public abstract class SchemaResult {

    /** Reserved error key for schema-level (cross-field) validation failures. */
    public static final String SCHEMA_ERRORS_KEY = "_schema";

    private final Object data;
    private final Map<Object, Object> errors;

    protected SchemaResult(Object data, Map<Object, Object> errors) {
        this.data = data;
        this.errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    /**
     * Returns the converted data: an ordered map, a list of ordered maps in many-mode, a typed
     * object when a load used an object factory, or encoded bytes for {@code dumps}.
     */
    public Object data() {
        return data;
    }

    /** Returns the data as a single-record map. */
    @SuppressWarnings("unchecked")
    public Map<String, Object> dataAsMap() {
        return (Map<String, Object>) data;
    }

    /** Returns the data as a many-mode list. */
    @SuppressWarnings("unchecked")
    public List<Object> dataAsList() {
        return (List<Object>) data;
    }

    /** Returns the data cast to {@code type}. */
    public <T> T dataAs(Class<T> type) {
        return type.cast(data);
    }

    /** Returns the unmodifiable error mapping, empty when the conversion succeeded. */
    public Map<Object, Object> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns the messages recorded for {@code field} in single-record mode, or an empty list if
     * the field has none or holds a nested error mapping.
     */
    @SuppressWarnings("unchecked")
    public List<String> messages(String field) {
        Object value = errors.get(field);
        return value instanceof List ? (List<String>) value : List.of();
    }

    /** Returns the nested error mapping recorded for {@code key}, or an empty map. */
    @SuppressWarnings("unchecked")
    public Map<Object, Object> nestedErrors(Object key) {
        Object value = errors.get(key);
        return value instanceof Map ? (Map<Object, Object>) value : Map.of();
    }
}
