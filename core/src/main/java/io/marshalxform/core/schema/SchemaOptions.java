package io.marshalxform.core.schema;

import io.marshalxform.core.codec.JacksonSchemaCodec;
import io.marshalxform.core.error.InvalidOptionException;
import io.marshalxform.core.spi.SchemaCodec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Class-level options of a schema definition. Immutable; created through {@link #builder()} or,
 * for loosely typed configuration such as YAML files, {@link #fromMap(Map, String)}.
 *
 * <ul>
 *   <li>{@code fields}: the exact field set, declared fields where present and pass-through fields
 *       otherwise
 *   <li>{@code additional}: pass-through fields added to the declared ones
 *   <li>{@code exclude}: fields left out of every instance
 *   <li>{@code dateformat}: default format of date-time fields that do not set one
 *   <li>{@code skipMissing}: omit keys whose source attribute is missing or {@code null} on dump
 *   <li>{@code strict}: default strictness of instances
 *   <li>{@code codec}: encoder/decoder used by {@code dumps} and {@code loads}
 * </ul>
 */
public final class SchemaOptions {

    /** Option names accepted by {@link #fromMap(Map, String)}. */
    public static final Set<String> KEYS =
            Set.of("fields", "additional", "exclude", "dateformat", "skip-missing", "strict", "codec");

    private static final SchemaOptions DEFAULTS = builder().build();

    private final List<String> fields;
    private final List<String> additional;
    private final List<String> exclude;
    private final String dateformat;
    private final boolean skipMissing;
    private final boolean strict;
    private final SchemaCodec codec;

    private SchemaOptions(Builder builder) {
        this.fields = builder.fields;
        this.additional = builder.additional;
        this.exclude = builder.exclude;
        this.dateformat = builder.dateformat;
        this.skipMissing = builder.skipMissing;
        this.strict = builder.strict;
        this.codec = builder.codec;
    }

    /** Options with every setting at its default. */
    public static SchemaOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds options from a raw mapping whose keys are {@link #KEYS}. Name-list options must be
     * sequences; {@code codec} may be a {@link SchemaCodec} or one of {@code json} and {@code yaml}.
     *
     * @param raw        the raw option mapping
     * @param schemaName the schema the options belong to, for error messages
     * @throws InvalidOptionException if a key is unknown or a value has the wrong shape
     */
    public static SchemaOptions fromMap(Map<String, ?> raw, String schemaName) {
        Builder builder = builder().schemaName(schemaName);
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "fields":
                    builder.fields(nameList(key, value, schemaName));
                    break;
                case "additional":
                    builder.additional(nameList(key, value, schemaName));
                    break;
                case "exclude":
                    builder.exclude(nameList(key, value, schemaName));
                    break;
                case "dateformat":
                    builder.dateformat(typed(key, value, String.class, schemaName));
                    break;
                case "skip-missing":
                    builder.skipMissing(typed(key, value, Boolean.class, schemaName));
                    break;
                case "strict":
                    builder.strict(typed(key, value, Boolean.class, schemaName));
                    break;
                case "codec":
                    builder.codec(codec(value, schemaName));
                    break;
                default:
                    throw new InvalidOptionException(
                            "Unknown schema option '" + key + "'; expected one of " + KEYS, schemaName);
            }
        }
        return builder.build();
    }

    private static List<String> nameList(String key, Object value, String schemaName) {
        Collection<?> names;
        if (value instanceof Collection) {
            names = (Collection<?>) value;
        } else if (value instanceof Object[]) {
            names = Arrays.asList((Object[]) value);
        } else {
            throw new InvalidOptionException(
                    "'" + key + "' option must be a list of field names, got: " + value, schemaName);
        }
        List<String> result = new ArrayList<>(names.size());
        for (Object name : names) {
            if (!(name instanceof String)) {
                throw new InvalidOptionException(
                        "'" + key + "' option must contain only field names, got: " + name, schemaName);
            }
            result.add((String) name);
        }
        return result;
    }

    private static <T> T typed(String key, Object value, Class<T> type, String schemaName) {
        if (!type.isInstance(value)) {
            throw new InvalidOptionException(
                    "'" + key + "' option must be a " + type.getSimpleName().toLowerCase() + ", got: " + value,
                    schemaName);
        }
        return type.cast(value);
    }

    private static SchemaCodec codec(Object value, String schemaName) {
        if (value instanceof SchemaCodec) {
            return (SchemaCodec) value;
        }
        if ("json".equals(value)) {
            return JacksonSchemaCodec.json();
        }
        if ("yaml".equals(value)) {
            return JacksonSchemaCodec.yaml();
        }
        throw new InvalidOptionException("'codec' option must be 'json' or 'yaml', got: " + value, schemaName);
    }

    /** The exact field names, or {@code null} if not set. */
    public List<String> fields() {
        return fields;
    }

    /** The pass-through field names added to the declared ones, or {@code null} if not set. */
    public List<String> additional() {
        return additional;
    }

    public List<String> exclude() {
        return exclude;
    }

    /** The default date-time format, or {@code null} for ISO-8601. */
    public String dateformat() {
        return dateformat;
    }

    public boolean skipMissing() {
        return skipMissing;
    }

    public boolean strict() {
        return strict;
    }

    public SchemaCodec codec() {
        return codec;
    }

    @Override
    public String toString() {
        return "SchemaOptions[fields=" + fields + ", additional=" + additional + ", exclude=" + exclude
                + ", dateformat=" + dateformat + ", skipMissing=" + skipMissing + ", strict=" + strict + "]";
    }

    /** Builder for {@link SchemaOptions}. */
    public static final class Builder {

        private String schemaName;
        private List<String> fields;
        private List<String> additional;
        private List<String> exclude = List.of();
        private String dateformat;
        private boolean skipMissing;
        private boolean strict;
        private SchemaCodec codec = JacksonSchemaCodec.json();

        private Builder() {}

        /**
         * Schema name reported by {@link InvalidOptionException}.
         *
         * @return this builder (fluent)
         */
        public Builder schemaName(String schemaName) {
            this.schemaName = schemaName;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder fields(String... names) {
            return fields(List.of(names));
        }

        /** @return this builder (fluent) */
        public Builder fields(Collection<String> names) {
            this.fields = List.copyOf(names);
            return this;
        }

        /** @return this builder (fluent) */
        public Builder additional(String... names) {
            return additional(List.of(names));
        }

        /** @return this builder (fluent) */
        public Builder additional(Collection<String> names) {
            this.additional = List.copyOf(names);
            return this;
        }

        /** @return this builder (fluent) */
        public Builder exclude(String... names) {
            return exclude(List.of(names));
        }

        /** @return this builder (fluent) */
        public Builder exclude(Collection<String> names) {
            this.exclude = List.copyOf(names);
            return this;
        }

        /** @return this builder (fluent) */
        public Builder dateformat(String dateformat) {
            this.dateformat = dateformat;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder skipMissing(boolean skipMissing) {
            this.skipMissing = skipMissing;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder codec(SchemaCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec must not be null");
            return this;
        }

        /**
         * Builds the options.
         *
         * @throws InvalidOptionException if both {@code fields} and {@code additional} are set
         */
        public SchemaOptions build() {
            if (fields != null && additional != null) {
                throw new InvalidOptionException(
                        "Cannot set both 'fields' and 'additional' options on the same schema", schemaName);
            }
            return new SchemaOptions(this);
        }
    }
}
