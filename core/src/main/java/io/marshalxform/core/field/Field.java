package io.marshalxform.core.field;

import io.marshalxform.core.error.ConversionException;
import io.marshalxform.core.error.RequiredFieldException;
import io.marshalxform.core.error.SchemaException.Phase;
import io.marshalxform.core.error.ValidationException;
import io.marshalxform.core.model.Missing;
import io.marshalxform.core.schema.Schema;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Base class of every field kind. A field converts one attribute of a source object into its
 * representation ({@link #serialize}) and one value of an input mapping back into a typed value
 * ({@link #deserialize}).
 *
 * <p>Fields declared on a schema definition are templates. A {@link Schema} never uses them
 * directly: it binds its own copy of each one through {@link #bind(String, Schema)}, so per-schema
 * state (the field name, the owning schema, resolved formats) is never shared between schema
 * instances. Subclasses that hold mutable state of their own must override {@link #onBind(Schema)}
 * to give each copy a fresh instance of it.
 *
 * <p>Subclasses implement {@link #format(Object)} and {@link #convert(Object)}; both receive values
 * that are neither {@code null} nor {@link Missing#VALUE}.
 */
public abstract class Field implements Cloneable {

    private String name;
    private Schema parent;

    private String attribute;
    private Object defaultValue = Missing.VALUE;
    private boolean required;
    private boolean allowNull = true;
    private List<Predicate<Object>> validators = List.of();
    private String error;

    protected Field() {}

    // --- declaration (fluent) ---

    /**
     * Reads the value from (on dump) and writes it to (on load) {@code attribute} instead of the
     * field name. Dotted paths are followed on dump.
     *
     * @return this field (fluent)
     */
    public Field attribute(String attribute) {
        this.attribute = attribute;
        return this;
    }

    /**
     * Value emitted on dump when the source attribute is {@code null} or missing. A {@link
     * Supplier} is called each time the default is needed.
     *
     * @return this field (fluent)
     */
    public Field defaultValue(Object defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    /**
     * Marks the field as required on load.
     *
     * @return this field (fluent)
     */
    public Field required() {
        return required(true);
    }

    /** @return this field (fluent) */
    public Field required(boolean required) {
        this.required = required;
        return this;
    }

    /**
     * Whether an explicit {@code null} is accepted on load. Defaults to {@code true}.
     *
     * @return this field (fluent)
     */
    public Field allowNull(boolean allowNull) {
        this.allowNull = allowNull;
        return this;
    }

    /**
     * Adds validators run against the converted value on load. A validator rejects a value by
     * returning {@code false} or by throwing {@link ValidationException}.
     *
     * @return this field (fluent)
     */
    @SafeVarargs
    public final Field validate(Predicate<Object>... predicates) {
        List<Predicate<Object>> combined = new ArrayList<>(validators);
        for (Predicate<Object> predicate : predicates) {
            combined.add(Objects.requireNonNull(predicate, "validator must not be null"));
        }
        this.validators = List.copyOf(combined);
        return this;
    }

    /**
     * Replaces the message of every conversion and validation error raised by this field. The
     * required-field message is never replaced.
     *
     * @return this field (fluent)
     */
    public Field error(String message) {
        this.error = message;
        return this;
    }

    // --- binding ---

    /**
     * Returns a copy of this field bound to {@code parent} under {@code name}. The template is left
     * untouched.
     */
    public final Field bind(String name, Schema parent) {
        Objects.requireNonNull(name, "name must not be null");
        Field copy = copy();
        copy.name = name;
        copy.parent = parent;
        copy.onBind(parent);
        return copy;
    }

    /** Hook for subclasses to resolve schema-dependent settings on a freshly bound copy. */
    protected void onBind(Schema parent) {}

    /** Shallow copy; subclasses with mutable state reset it in {@link #onBind}. */
    protected Field copy() {
        try {
            return (Field) clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("Field is Cloneable", e);
        }
    }

    // --- accessors ---

    /** The name the field is bound under, or {@code null} for an unbound template. */
    public String name() {
        return name;
    }

    /** The source/target attribute, or {@code null} if it is the field name. */
    public String attribute() {
        return attribute;
    }

    /** The attribute read on dump and the key written on load. */
    public String key() {
        return attribute != null ? attribute : name;
    }

    public Schema parent() {
        return parent;
    }

    public boolean isBound() {
        return parent != null;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean allowsNull() {
        return allowNull;
    }

    public List<Predicate<Object>> validators() {
        return validators;
    }

    public String errorMessage() {
        return error;
    }

    /** The owning schema's context, or {@code null} if it has none. */
    public Map<String, Object> context() {
        return parent == null ? null : parent.context();
    }

    /** Short name of the field kind, as used in YAML schema definitions. */
    public abstract String kind();

    /** Returns {@code true} for fields that only produce output and are skipped on load. */
    public boolean isDumpOnly() {
        return false;
    }

    /** The value emitted on dump for a {@code null} or missing attribute. */
    public Object defaultValue() {
        Object value = Missing.isMissing(defaultValue) ? kindDefault() : defaultValue;
        return value instanceof Supplier ? ((Supplier<?>) value).get() : value;
    }

    /** Returns {@code true} if a default was declared explicitly rather than inherited from the kind. */
    public boolean hasExplicitDefault() {
        return !Missing.isMissing(defaultValue);
    }

    /** The default of this field kind when none is declared. */
    protected Object kindDefault() {
        return null;
    }

    // --- dump ---

    /**
     * Resolves this field's attribute on {@code source}.
     *
     * @return the value, {@code null}, or {@link Missing#VALUE} when absent or {@code source} is null
     */
    public Object getValue(Object source) {
        if (source == null) {
            return Missing.VALUE;
        }
        if (parent == null) {
            throw new IllegalStateException("Field '" + name + "' is not bound to a schema");
        }
        return parent.attributeResolver().resolve(source, key());
    }

    /** Reads and formats this field's attribute from {@code source}. */
    public Object serialize(Object source) {
        return serializeValue(getValue(source));
    }

    /**
     * Formats a raw attribute value. {@code null} and {@link Missing#VALUE} produce the default.
     *
     * @throws ConversionException if the value cannot be formatted
     */
    public Object serializeValue(Object value) {
        if (Missing.isMissingOrNull(value)) {
            return defaultValue();
        }
        return format(value);
    }

    /** Formats a present, non-null value. */
    protected abstract Object format(Object value);

    // --- load ---

    /**
     * Converts and validates one input value.
     *
     * @param value the input value, or {@link Missing#VALUE} if the key was absent
     * @return the converted value, {@code null}, or {@link Missing#VALUE} to leave the key out
     * @throws RequiredFieldException if the field is required and the key is absent
     * @throws ConversionException    if conversion or validation fails
     */
    public Object deserialize(Object value) {
        if (Missing.isMissing(value)) {
            if (required) {
                throw new RequiredFieldException(schemaName(), name);
            }
            return Missing.VALUE;
        }
        if (value == null) {
            if (!allowNull) {
                throw loadError("Field may not be null.");
            }
            return null;
        }
        Object converted = convert(value);
        runValidators(converted);
        return converted;
    }

    /** Converts a present, non-null input value. */
    protected abstract Object convert(Object value);

    private void runValidators(Object value) {
        if (validators.isEmpty()) {
            return;
        }
        Set<String> messages = new LinkedHashSet<>();
        ValidationException firstCause = null;
        for (Predicate<Object> validator : validators) {
            try {
                if (!validator.test(value)) {
                    messages.add(error != null ? error : "Invalid value.");
                }
            } catch (ValidationException e) {
                messages.add(error != null ? error : e.getMessage());
                if (firstCause == null) {
                    firstCause = e;
                }
            }
        }
        if (!messages.isEmpty()) {
            ConversionException failure = new ConversionException(List.copyOf(messages), schemaName(), name, Phase.LOAD);
            if (firstCause != null) {
                failure.initCause(firstCause);
            }
            throw failure;
        }
    }

    // --- error helpers ---

    protected final String schemaName() {
        return parent == null ? null : parent.name();
    }

    protected final ConversionException dumpError(String message) {
        return new ConversionException(error != null ? error : message, schemaName(), name, Phase.DUMP);
    }

    protected final ConversionException dumpError(String message, Throwable cause) {
        return new ConversionException(error != null ? error : message, cause, schemaName(), name, Phase.DUMP);
    }

    protected final ConversionException loadError(String message) {
        return new ConversionException(error != null ? error : message, schemaName(), name, Phase.LOAD);
    }

    protected final ConversionException loadError(String message, Throwable cause) {
        return new ConversionException(error != null ? error : message, cause, schemaName(), name, Phase.LOAD);
    }

    /** Renders {@code value} in single quotes for error messages. */
    protected static String quoted(Object value) {
        return "'" + value + "'";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", attribute=" + attribute + ", required=" + required
                + "]";
    }
}
