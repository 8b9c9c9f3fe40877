package io.marshalxform.core.engine;

import io.marshalxform.core.error.ConversionException;
import io.marshalxform.core.error.MarshallingException;
import io.marshalxform.core.error.SchemaDataException;
import io.marshalxform.core.error.SchemaException.Phase;
import io.marshalxform.core.error.StrictModeException;
import io.marshalxform.core.error.UnmarshallingException;
import io.marshalxform.core.model.SchemaResult;
import io.marshalxform.core.schema.Schema;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the error mapping of one dump or load call. In many-mode each record gets a child
 * collector whose errors land under the record's index, created only when the record fails.
 *
 * <p>A fail-fast collector (strict schema without an error handler) raises the phase's {@link
 * StrictModeException} on the first error, carrying everything collected so far.
 */
final class ErrorCollector {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorCollector.class);

    private final Schema schema;
    private final Phase phase;
    private final boolean failFast;
    private final Map<Object, Object> root;
    private final Object index;
    private Map<Object, Object> target;

    private ErrorCollector(Schema schema, Phase phase, boolean failFast, Map<Object, Object> root, Object index) {
        this.schema = schema;
        this.phase = phase;
        this.failFast = failFast;
        this.root = root;
        this.index = index;
        this.target = index == null ? root : null;
    }

    /** A collector for one call on {@code schema}. */
    static ErrorCollector forCall(Schema schema, Phase phase) {
        boolean failFast = schema.isStrict() && schema.errorHandler() == null;
        return new ErrorCollector(schema, phase, failFast, new LinkedHashMap<>(), null);
    }

    /** A collector for the record at {@code index} in many-mode. */
    ErrorCollector forItem(int index) {
        return new ErrorCollector(schema, phase, failFast, root, index);
    }

    /** Records a field error: its messages, or its nested error mapping. */
    @SuppressWarnings("unchecked")
    void fieldError(String fieldName, SchemaDataException error) {
        Map<Object, Object> errors = target();
        if (error instanceof ConversionException && ((ConversionException) error).isNested()) {
            errors.put(fieldName, ((ConversionException) error).nestedErrors());
        } else {
            Object existing = errors.get(fieldName);
            List<String> messages = existing instanceof List ? (List<String>) existing : new ArrayList<>();
            messages.addAll(error.messages());
            errors.put(fieldName, messages);
        }
        if (failFast) {
            String message = SchemaResult.SCHEMA_ERRORS_KEY.equals(fieldName)
                    ? "Error " + verb() + " " + schema.name() + ": " + error.getMessage()
                    : "Error " + verb() + " field '" + fieldName + "': " + error.getMessage();
            throw strictFailure(message, error);
        }
    }

    /** Records a schema-level error under {@link SchemaResult#SCHEMA_ERRORS_KEY}. */
    void schemaError(SchemaDataException error) {
        fieldError(SchemaResult.SCHEMA_ERRORS_KEY, error);
    }

    boolean hasErrors() {
        return !root.isEmpty();
    }

    /** Returns {@code true} if this record (or, for the top-level collector, the call) has errors. */
    boolean recordHasErrors() {
        return target != null && !target.isEmpty();
    }

    Map<Object, Object> errors() {
        return root;
    }

    private Map<Object, Object> target() {
        if (target == null) {
            target = new LinkedHashMap<>();
            root.put(index, target);
        }
        return target;
    }

    private String verb() {
        return phase == Phase.DUMP ? "dumping" : "loading";
    }

    private StrictModeException strictFailure(String message, Throwable cause) {
        LOG.debug("Strict schema {} raising on {}: {}", schema.name(), verb(), message);
        if (phase == Phase.DUMP) {
            return new MarshallingException(message, cause, schema.name(), root);
        }
        return new UnmarshallingException(message, cause, schema.name(), root);
    }
}
