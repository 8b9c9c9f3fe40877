package io.marshalxform.core.schema;

import io.marshalxform.core.access.AttributeResolver;
import io.marshalxform.core.engine.Marshaller;
import io.marshalxform.core.engine.Unmarshaller;
import io.marshalxform.core.error.ImplicitCollectionException;
import io.marshalxform.core.error.MarshallingException;
import io.marshalxform.core.error.UnknownFieldException;
import io.marshalxform.core.error.UnmarshallingException;
import io.marshalxform.core.field.Field;
import io.marshalxform.core.model.MarshalResult;
import io.marshalxform.core.model.UnmarshalResult;
import io.marshalxform.core.spi.DataHandler;
import io.marshalxform.core.spi.ErrorHandler;
import io.marshalxform.core.spi.ObjectFactory;
import io.marshalxform.core.spi.Preprocessor;
import io.marshalxform.core.spi.SchemaCodec;
import io.marshalxform.core.spi.SchemaValidator;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A configured schema: the resolved, ordered set of bound fields of a {@link SchemaDefinition},
 * adjusted by per-instance {@link SchemaSettings}, plus the context map and strictness used by
 * {@link #dump} and {@link #load}.
 *
 * <p>Schemas that need methods for {@link io.marshalxform.core.field.MethodField}s subclass this
 * class and are built with {@link SchemaDefinition#builder(Class, SchemaFactory)}:
 *
 * <pre>{@code
 * public class UserSchema extends Schema {
 *     public static final SchemaDefinition DEFINITION = SchemaDefinition.builder(UserSchema.class, UserSchema::new)
 *             .field("name", new StringField())
 *             .field("is_old", new MethodField("isOld"))
 *             .build();
 *
 *     public UserSchema(SchemaDefinition definition, SchemaSettings settings) {
 *         super(definition, settings);
 *     }
 *
 *     public boolean isOld(User user) {
 *         return user.getAge() > 80;
 *     }
 * }
 * }</pre>
 *
 * <p>An instance may be used concurrently as long as nobody changes its context or strictness.
 */
public class Schema {

    private static final Logger LOG = LoggerFactory.getLogger(Schema.class);

    private final SchemaDefinition definition;
    private final SchemaSettings settings;
    private final Map<String, Field> fields;
    private final List<SchemaValidator> validators;
    private final List<Preprocessor> preprocessors;
    private final List<DataHandler> dataHandlers;
    private final ErrorHandler errorHandler;
    private final ObjectFactory objectFactory;

    private volatile boolean strict;
    private volatile Map<String, Object> context;

    /**
     * Creates an instance of {@code definition}.
     *
     * @throws UnknownFieldException if {@code settings.only()} names a field the definition lacks
     */
    public Schema(SchemaDefinition definition, SchemaSettings settings) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.settings = settings == null ? SchemaSettings.defaults() : settings;
        this.strict = this.settings.strict() != null ? this.settings.strict() : definition.options().strict();
        this.context = this.settings.context() != null ? this.settings.context() : new HashMap<>();
        this.validators = List.copyOf(definition.effectiveValidators());
        this.preprocessors = List.copyOf(definition.effectivePreprocessors());
        this.dataHandlers = List.copyOf(definition.effectiveDataHandlers());
        this.errorHandler = definition.effectiveErrorHandler();
        this.objectFactory = definition.effectiveObjectFactory();
        this.fields = Collections.unmodifiableMap(bindFields());
        LOG.debug("Created schema {}", this);
    }

    private Map<String, Field> bindFields() {
        Map<String, Field> templates = definition.fields();
        Set<String> selected;
        if (settings.only() != null) {
            for (String name : settings.only()) {
                if (!templates.containsKey(name)) {
                    throw new UnknownFieldException(
                            "Invalid field name '" + name + "' in only: schema " + definition.name()
                                    + " has no such field",
                            definition.name(),
                            name);
                }
            }
            selected = new LinkedHashSet<>(settings.only());
        } else {
            selected = new LinkedHashSet<>(templates.keySet());
            settings.exclude().forEach(selected::remove);
        }
        Map<String, Field> bound = new LinkedHashMap<>();
        for (Map.Entry<String, Field> entry : templates.entrySet()) {
            if (selected.contains(entry.getKey())) {
                bound.put(entry.getKey(), entry.getValue().bind(entry.getKey(), this));
            }
        }
        return bound;
    }

    // --- operations ---

    /**
     * Converts {@code source} (or, in many-mode, each element of it) into an ordered mapping.
     *
     * @throws ImplicitCollectionException if the schema is not in many-mode and {@code source} is a
     *     sequence
     * @throws MarshallingException        if the schema is strict and a field or data handler fails
     */
    public MarshalResult dump(Object source) {
        return Marshaller.dump(this, source);
    }

    /** Like {@link #dump}, with the data encoded by the definition's codec. */
    public MarshalResult dumps(Object source) {
        MarshalResult result = dump(source);
        return MarshalResult.of(codec().encode(result.data()), result.errors());
    }

    /**
     * Converts an input mapping (or, in many-mode, a sequence of them) into converted fields or a
     * typed object.
     *
     * @throws UnmarshallingException if the schema is strict and a field or validator fails
     */
    public UnmarshalResult load(Object input) {
        return Unmarshaller.load(this, input);
    }

    /** Decodes {@code payload} with the definition's codec, then loads it. */
    public UnmarshalResult loads(byte[] payload) {
        return load(codec().decode(payload));
    }

    /** Decodes UTF-8 {@code payload} with the definition's codec, then loads it. */
    public UnmarshalResult loads(String payload) {
        return loads(payload.getBytes(StandardCharsets.UTF_8));
    }

    // --- accessors ---

    public String name() {
        return definition.name();
    }

    public SchemaDefinition definition() {
        return definition;
    }

    public SchemaOptions options() {
        return definition.options();
    }

    public SchemaCodec codec() {
        return definition.options().codec();
    }

    public AttributeResolver attributeResolver() {
        return definition.attributeResolver();
    }

    /** The bound fields in output order. */
    public Map<String, Field> fields() {
        return fields;
    }

    /** Output field names in order. */
    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public String prefix() {
        return settings.prefix();
    }

    public Map<String, Object> extra() {
        return settings.extra();
    }

    public boolean isMany() {
        return settings.many();
    }

    public boolean isEmbedded() {
        return settings.embedded();
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    /**
     * The live context map shared with every field and nested schema, or {@code null} after {@code
     * setContext(null)}.
     */
    public Map<String, Object> context() {
        return context;
    }

    /** Replaces the context; {@code null} means no context is available. */
    public void setContext(Map<String, Object> context) {
        this.context = context;
    }

    public List<SchemaValidator> validators() {
        return validators;
    }

    public List<Preprocessor> preprocessors() {
        return preprocessors;
    }

    public List<DataHandler> dataHandlers() {
        return dataHandlers;
    }

    /** The error handler, or {@code null}. Embedded schemas never use one. */
    public ErrorHandler errorHandler() {
        return isEmbedded() ? null : errorHandler;
    }

    public ObjectFactory objectFactory() {
        return objectFactory;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name() + ", many=" + isMany() + ", strict=" + strict
                + ", fields=" + fields.keySet() + "]";
    }
}
