package io.marshalxform.core.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-instance settings applied when a {@link Schema} is created from a definition.
 *
 * @see SchemaDefinition#newSchema(SchemaSettings)
 */
public final class SchemaSettings {

    private static final SchemaSettings DEFAULTS = builder().build();

    private final List<String> only;
    private final List<String> exclude;
    private final String prefix;
    private final Map<String, Object> extra;
    private final boolean many;
    private final Boolean strict;
    private final Map<String, Object> context;
    private final boolean embedded;

    private SchemaSettings(Builder builder) {
        this.only = builder.only;
        this.exclude = builder.exclude;
        this.prefix = builder.prefix;
        this.extra = builder.extra;
        this.many = builder.many;
        this.strict = builder.strict;
        this.context = builder.context;
        this.embedded = builder.embedded;
    }

    public static SchemaSettings defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Field names to keep, in output order, or {@code null} for all. */
    public List<String> only() {
        return only;
    }

    public List<String> exclude() {
        return exclude;
    }

    /** Prepended to every output key on dump. Empty by default. */
    public String prefix() {
        return prefix;
    }

    /** Key/value pairs overlaid on every dumped record, or {@code null}. */
    public Map<String, Object> extra() {
        return extra;
    }

    public boolean many() {
        return many;
    }

    /** Explicit strictness, or {@code null} to use the definition's {@code strict} option. */
    public Boolean strict() {
        return strict;
    }

    /** Initial context, or {@code null} for a fresh empty map. */
    public Map<String, Object> context() {
        return context;
    }

    /**
     * Whether the schema is embedded in a parent's nested field. An embedded schema returns its
     * errors to the parent and never hands them to an error handler.
     */
    public boolean embedded() {
        return embedded;
    }

    /** Builder for {@link SchemaSettings}. */
    public static final class Builder {

        private List<String> only;
        private List<String> exclude = List.of();
        private String prefix = "";
        private Map<String, Object> extra;
        private boolean many;
        private Boolean strict;
        private Map<String, Object> context;
        private boolean embedded;

        private Builder() {}

        /** @return this builder (fluent) */
        public Builder only(String... names) {
            return only(List.of(names));
        }

        /** @return this builder (fluent) */
        public Builder only(Collection<String> names) {
            this.only = names == null ? null : List.copyOf(names);
            return this;
        }

        /** @return this builder (fluent) */
        public Builder exclude(String... names) {
            return exclude(List.of(names));
        }

        /** @return this builder (fluent) */
        public Builder exclude(Collection<String> names) {
            this.exclude = names == null ? List.of() : List.copyOf(names);
            return this;
        }

        /** @return this builder (fluent) */
        public Builder prefix(String prefix) {
            this.prefix = prefix == null ? "" : prefix;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder extra(Map<String, ?> extra) {
            this.extra = extra == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
            return this;
        }

        /** @return this builder (fluent) */
        public Builder many(boolean many) {
            this.many = many;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder strict(Boolean strict) {
            this.strict = strict;
            return this;
        }

        /**
         * Initial context. The map is copied; later changes go through {@link Schema#context()}.
         *
         * @return this builder (fluent)
         */
        public Builder context(Map<String, ?> context) {
            this.context = context == null ? null : new HashMap<>(context);
            return this;
        }

        /** @return this builder (fluent) */
        public Builder embedded(boolean embedded) {
            this.embedded = embedded;
            return this;
        }

        public SchemaSettings build() {
            return new SchemaSettings(this);
        }
    }
}
