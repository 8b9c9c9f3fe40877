package io.marshalxform.core.field;

import io.marshalxform.core.error.ConversionException;
import io.marshalxform.core.error.InvalidFieldDeclarationException;
import io.marshalxform.core.error.SchemaException.Phase;
import io.marshalxform.core.error.UnknownSchemaException;
import io.marshalxform.core.model.MarshalResult;
import io.marshalxform.core.model.UnmarshalResult;
import io.marshalxform.core.schema.Schema;
import io.marshalxform.core.schema.SchemaDefinition;
import io.marshalxform.core.schema.SchemaSettings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Embeds another schema. The target is a {@link SchemaDefinition}, the name or schema type of a
 * registered definition, or {@link #self()} for the definition of the schema the field is bound
 * to. Name and type targets are resolved on first use, so definitions may refer to each other in
 * any order.
 *
 * <p>The embedded schema is created once per bound field and shares the parent's context map by
 * reference. Its errors are reported under this field's name as a nested error mapping.
 */
public class NestedField extends Field {

    private static final Object SELF = new Object() {
        @Override
        public String toString() {
            return "self";
        }
    };

    private final Object target;
    private List<String> only;
    private List<String> exclude = List.of();
    private boolean many;
    private String flat;
    private String prefix = "";

    private volatile Schema schema;

    /** Nests the given definition. */
    public NestedField(SchemaDefinition target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    /** Nests the definition registered under {@code schemaName}. */
    public NestedField(String schemaName) {
        this.target = Objects.requireNonNull(schemaName, "schemaName must not be null");
    }

    /**
     * Nests the definition registered for {@code schemaType}.
     *
     * @throws InvalidFieldDeclarationException if {@code schemaType} is not a {@link Schema} subtype
     */
    public NestedField(Class<?> schemaType) {
        Objects.requireNonNull(schemaType, "schemaType must not be null");
        if (!Schema.class.isAssignableFrom(schemaType)) {
            throw new InvalidFieldDeclarationException(
                    "Nested field target " + schemaType.getName() + " is not a Schema type", null, null);
        }
        this.target = schemaType;
    }

    private NestedField(Object target) {
        this.target = target;
    }

    /** Nests the schema the field is bound to (or the subclass it was inherited by). */
    public static NestedField self() {
        return new NestedField(SELF);
    }

    /**
     * Restricts the embedded schema to these fields. Output keeps the declared field order.
     *
     * @return this field (fluent)
     */
    public NestedField only(String... names) {
        return only(List.of(names));
    }

    /** @return this field (fluent) */
    public NestedField only(Collection<String> names) {
        this.only = List.copyOf(names);
        return this;
    }

    /**
     * Leaves these fields out of the embedded schema.
     *
     * @return this field (fluent)
     */
    public NestedField exclude(String... names) {
        return exclude(List.of(names));
    }

    /** @return this field (fluent) */
    public NestedField exclude(Collection<String> names) {
        this.exclude = List.copyOf(names);
        return this;
    }

    /**
     * The attribute holds a sequence of objects.
     *
     * @return this field (fluent)
     */
    public NestedField many() {
        return many(true);
    }

    /** @return this field (fluent) */
    public NestedField many(boolean many) {
        this.many = many;
        return this;
    }

    /**
     * Emits only the embedded schema's {@code fieldName} value (or the list of them in many-mode)
     * instead of the whole mapping. The embedded schema is limited to that field.
     *
     * @return this field (fluent)
     */
    public NestedField flat(String fieldName) {
        this.flat = Objects.requireNonNull(fieldName, "fieldName must not be null");
        return this;
    }

    /**
     * Prefixes the embedded schema's output keys on dump.
     *
     * @return this field (fluent)
     */
    public NestedField prefix(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
        return this;
    }

    public boolean isMany() {
        return many;
    }

    public boolean isSelf() {
        return target == SELF;
    }

    public String flatField() {
        return flat;
    }

    @Override
    public String kind() {
        return "nested";
    }

    @Override
    protected void onBind(Schema parent) {
        schema = null;
    }

    /**
     * The embedded schema, created on first use. Two threads racing on the first call may each
     * build one; both are equivalent and the last write wins. The context is only written when the
     * parent's context map was replaced, so concurrent calls on an unchanged schema do not write.
     */
    public Schema schema() {
        Schema embedded = schema;
        if (embedded == null) {
            SchemaSettings.Builder settings = SchemaSettings.builder()
                    .exclude(exclude)
                    .many(many)
                    .prefix(prefix)
                    .strict(false)
                    .embedded(true);
            if (flat != null) {
                settings.only(List.of(flat));
            } else if (only != null) {
                settings.only(only);
            }
            embedded = resolveDefinition().newSchema(settings.build());
            schema = embedded;
        }
        Map<String, Object> context = context();
        if (embedded.context() != context) {
            embedded.setContext(context);
        }
        return embedded;
    }

    private SchemaDefinition resolveDefinition() {
        if (target instanceof SchemaDefinition) {
            return (SchemaDefinition) target;
        }
        Schema owner = parent();
        if (owner == null) {
            throw new IllegalStateException("Nested field '" + name() + "' is not bound to a schema");
        }
        if (target == SELF) {
            return owner.definition();
        }
        if (target instanceof String) {
            return owner.definition()
                    .registry()
                    .find((String) target)
                    .orElseThrow(() -> new UnknownSchemaException(
                            "No schema registered under name '" + target + "'", owner.name(), name()));
        }
        Class<?> type = (Class<?>) target;
        return owner.definition()
                .registry()
                .find(type)
                .orElseThrow(() -> new UnknownSchemaException(
                        "No schema registered for type " + type.getName(), owner.name(), name()));
    }

    @Override
    protected Object format(Object value) {
        MarshalResult result = schema().dump(value);
        if (result.hasErrors()) {
            throw new ConversionException(result.errors(), schemaName(), name(), Phase.DUMP);
        }
        return flat == null ? result.data() : flatten(result.data());
    }

    @Override
    protected Object convert(Object value) {
        Object input = flat == null ? value : unflatten(value);
        UnmarshalResult result = schema().load(input);
        if (result.hasErrors()) {
            throw new ConversionException(result.errors(), schemaName(), name(), Phase.LOAD);
        }
        return result.data();
    }

    private Object flatten(Object data) {
        String key = prefix + flat;
        if (many) {
            List<Object> values = new ArrayList<>();
            for (Object item : (List<?>) data) {
                values.add(((Map<?, ?>) item).get(key));
            }
            return values;
        }
        return ((Map<?, ?>) data).get(key);
    }

    private Object unflatten(Object value) {
        if (many && value instanceof Collection) {
            List<Object> records = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                records.add(record(item));
            }
            return records;
        }
        return record(value);
    }

    private Map<String, Object> record(Object value) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(flat, value);
        return record;
    }
}
