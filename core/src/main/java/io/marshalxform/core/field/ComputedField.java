package io.marshalxform.core.field;

import io.marshalxform.core.error.ConversionException;
import io.marshalxform.core.error.SchemaException;
import io.marshalxform.core.model.Missing;
import java.util.Map;

/**
 * Base for dump-only fields whose value is computed from the whole source object, optionally with
 * the schema context. Skipped on load.
 */
public abstract class ComputedField extends Field {

    @Override
    public final boolean isDumpOnly() {
        return true;
    }

    @Override
    public final Object serialize(Object source) {
        Map<String, Object> context = context();
        if (requiresContext() && (context == null || context.isEmpty())) {
            throw dumpError("No context available for " + label() + " field '" + name() + "'");
        }
        Object value;
        try {
            value = compute(source, context);
        } catch (SchemaException e) {
            throw e;
        } catch (RuntimeException e) {
            throw dumpError(String.valueOf(e.getMessage()), e);
        }
        return Missing.isMissing(value) ? defaultValue() : value;
    }

    @Override
    public final Object deserialize(Object value) {
        return Missing.VALUE;
    }

    @Override
    protected final Object format(Object value) {
        return value;
    }

    @Override
    protected final Object convert(Object value) {
        return value;
    }

    /** Kind label used in the missing-context message, e.g. {@code Method}. */
    protected abstract String label();

    /** Returns {@code true} if {@link #compute} needs a non-empty context. */
    protected abstract boolean requiresContext();

    /**
     * Computes the field value.
     *
     * @param source  the object being dumped, may be {@code null}
     * @param context the schema context, non-empty whenever {@link #requiresContext()} is true
     * @throws ConversionException to report a field error
     */
    protected abstract Object compute(Object source, Map<String, Object> context);
}
