package io.marshalxform.core.schema;

import io.marshalxform.core.access.AttributeResolver;
import io.marshalxform.core.error.InvalidFieldDeclarationException;
import io.marshalxform.core.error.InvalidHierarchyException;
import io.marshalxform.core.field.Field;
import io.marshalxform.core.field.InferredField;
import io.marshalxform.core.spi.AttributeAccessor;
import io.marshalxform.core.spi.DataHandler;
import io.marshalxform.core.spi.ErrorHandler;
import io.marshalxform.core.spi.ObjectFactory;
import io.marshalxform.core.spi.Preprocessor;
import io.marshalxform.core.spi.SchemaValidator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class-level metadata of a schema: its declared fields, parents, options and hooks. Built once,
 * then used to create any number of {@link Schema} instances.
 *
 * <p>Parents are linearized with the C3 algorithm, so diamond hierarchies inherit each ancestor
 * once and in a consistent order. Fields are merged from the most basic ancestor to this
 * definition; a field redeclared further down replaces the inherited one in its original position.
 * Options come from this definition, or else from the first parent in linearization order that
 * declares them. Hooks (validators, preprocessors, data handlers) are concatenated base-to-derived;
 * the error handler and object factory come from the nearest definition that declares one.
 *
 * <p>Hooks may also be registered after the definition is built; they apply to schemas created
 * afterwards. Thread-safe.
 */
public final class SchemaDefinition {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDefinition.class);

    private final String name;
    private final Class<? extends Schema> type;
    private final SchemaFactory<? extends Schema> factory;
    private final List<SchemaDefinition> parents;
    private final List<SchemaDefinition> linearization;
    private final Map<String, Field> declaredFields;
    private final Map<String, Field> fields;
    private final SchemaOptions declaredOptions;
    private final SchemaOptions options;
    private final SchemaRegistry registry;
    private final AttributeResolver attributeResolver;

    private final List<SchemaValidator> validators = new CopyOnWriteArrayList<>();
    private final List<Preprocessor> preprocessors = new CopyOnWriteArrayList<>();
    private final List<DataHandler> dataHandlers = new CopyOnWriteArrayList<>();
    private final List<AttributeAccessor> accessors;
    private volatile ErrorHandler errorHandler;
    private volatile ObjectFactory objectFactory;

    private SchemaDefinition(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.factory = builder.factory;
        this.parents = List.copyOf(builder.parents);
        this.registry = builder.registry;
        this.declaredFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.declaredOptions = builder.options;
        this.accessors = List.copyOf(builder.accessors);
        this.validators.addAll(builder.validators);
        this.preprocessors.addAll(builder.preprocessors);
        this.dataHandlers.addAll(builder.dataHandlers);
        this.errorHandler = builder.errorHandler;
        this.objectFactory = builder.objectFactory;

        this.linearization = linearize(this, parents);
        this.options = resolveOptions();
        this.fields = Collections.unmodifiableMap(resolveFields());
        this.attributeResolver = resolveAccessors();
    }

    /** Starts a definition whose instances are plain {@link Schema} objects. */
    public static Builder builder(String name) {
        return new Builder(name, Schema.class, Schema::new);
    }

    /**
     * Starts a definition for a {@link Schema} subclass, named after the class. Use this when the
     * schema declares methods for {@link io.marshalxform.core.field.MethodField}s.
     *
     * @param type    the schema subclass
     * @param factory creates instances, typically {@code MySchema::new}
     */
    public static <S extends Schema> Builder builder(Class<S> type, SchemaFactory<S> factory) {
        return new Builder(type.getSimpleName(), type, factory);
    }

    // --- linearization ---

    private static List<SchemaDefinition> linearize(SchemaDefinition self, List<SchemaDefinition> parents) {
        List<List<SchemaDefinition>> sequences = new ArrayList<>();
        for (SchemaDefinition parent : parents) {
            sequences.add(new ArrayList<>(parent.linearization));
        }
        sequences.add(new ArrayList<>(parents));

        List<SchemaDefinition> result = new ArrayList<>();
        result.add(self);
        while (true) {
            sequences.removeIf(List::isEmpty);
            if (sequences.isEmpty()) {
                return Collections.unmodifiableList(result);
            }
            SchemaDefinition next = null;
            for (List<SchemaDefinition> sequence : sequences) {
                SchemaDefinition candidate = sequence.get(0);
                if (!inAnyTail(candidate, sequences)) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                throw new InvalidHierarchyException(
                        "Cannot create a consistent inheritance order for parents " + names(parents), self.name);
            }
            result.add(next);
            for (List<SchemaDefinition> sequence : sequences) {
                if (sequence.get(0) == next) {
                    sequence.remove(0);
                }
            }
        }
    }

    private static boolean inAnyTail(SchemaDefinition candidate, List<List<SchemaDefinition>> sequences) {
        for (List<SchemaDefinition> sequence : sequences) {
            if (sequence.indexOf(candidate) > 0) {
                return true;
            }
        }
        return false;
    }

    private static List<String> names(List<SchemaDefinition> definitions) {
        List<String> names = new ArrayList<>();
        for (SchemaDefinition definition : definitions) {
            names.add(definition.name);
        }
        return names;
    }

    // --- resolution ---

    private SchemaOptions resolveOptions() {
        for (SchemaDefinition definition : linearization) {
            if (definition.declaredOptions != null) {
                return definition.declaredOptions;
            }
        }
        return SchemaOptions.defaults();
    }

    private Map<String, Field> resolveFields() {
        Map<String, Field> merged = new LinkedHashMap<>();
        for (int i = linearization.size() - 1; i >= 0; i--) {
            merged.putAll(linearization.get(i).declaredFields);
        }
        Map<String, Field> resolved;
        if (options.fields() != null) {
            resolved = new LinkedHashMap<>();
            for (String fieldName : options.fields()) {
                resolved.put(fieldName, merged.containsKey(fieldName) ? merged.get(fieldName) : new InferredField());
            }
        } else {
            resolved = merged;
            if (options.additional() != null) {
                for (String fieldName : options.additional()) {
                    resolved.putIfAbsent(fieldName, new InferredField());
                }
            }
        }
        for (String excluded : options.exclude()) {
            resolved.remove(excluded);
        }
        return resolved;
    }

    private AttributeResolver resolveAccessors() {
        List<AttributeAccessor> custom = new ArrayList<>();
        for (SchemaDefinition definition : linearization) {
            custom.addAll(definition.accessors);
        }
        return AttributeResolver.standard().withPrepended(custom);
    }

    // --- accessors ---

    public String name() {
        return name;
    }

    /** The schema class instances are created as; {@link Schema} for plain definitions. */
    public Class<? extends Schema> type() {
        return type;
    }

    public List<SchemaDefinition> parents() {
        return parents;
    }

    /** This definition followed by its ancestors in method-resolution order. */
    public List<SchemaDefinition> linearization() {
        return linearization;
    }

    /** Fields declared on this definition itself, in declaration order. */
    public Map<String, Field> declaredFields() {
        return declaredFields;
    }

    /**
     * The field templates instances start from: inherited and declared fields merged, then
     * adjusted by the {@code fields}, {@code additional} and {@code exclude} options.
     */
    public Map<String, Field> fields() {
        return fields;
    }

    /** The effective options. */
    public SchemaOptions options() {
        return options;
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public AttributeResolver attributeResolver() {
        return attributeResolver;
    }

    // --- hooks ---

    /** Appends a cross-field validator run on load. */
    public void registerValidator(SchemaValidator validator) {
        validators.add(Objects.requireNonNull(validator, "validator must not be null"));
    }

    /** Appends a preprocessor run on load before conversion. */
    public void registerPreprocessor(Preprocessor preprocessor) {
        preprocessors.add(Objects.requireNonNull(preprocessor, "preprocessor must not be null"));
    }

    /** Appends a data handler run on each dumped record. */
    public void registerDataHandler(DataHandler handler) {
        dataHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
    }

    /** Sets the error handler, replacing any previous one; {@code null} removes it. */
    public void setErrorHandler(ErrorHandler handler) {
        this.errorHandler = handler;
    }

    /** Sets the object factory used for successful loads; {@code null} removes it. */
    public void setObjectFactory(ObjectFactory factory) {
        this.objectFactory = factory;
    }

    /** Validators of all ancestors and this definition, base first. */
    public List<SchemaValidator> effectiveValidators() {
        List<SchemaValidator> result = new ArrayList<>();
        for (int i = linearization.size() - 1; i >= 0; i--) {
            result.addAll(linearization.get(i).validators);
        }
        return result;
    }

    /** Preprocessors of all ancestors and this definition, base first. */
    public List<Preprocessor> effectivePreprocessors() {
        List<Preprocessor> result = new ArrayList<>();
        for (int i = linearization.size() - 1; i >= 0; i--) {
            result.addAll(linearization.get(i).preprocessors);
        }
        return result;
    }

    /** Data handlers of all ancestors and this definition, base first. */
    public List<DataHandler> effectiveDataHandlers() {
        List<DataHandler> result = new ArrayList<>();
        for (int i = linearization.size() - 1; i >= 0; i--) {
            result.addAll(linearization.get(i).dataHandlers);
        }
        return result;
    }

    /** The nearest error handler in linearization order, or {@code null}. */
    public ErrorHandler effectiveErrorHandler() {
        for (SchemaDefinition definition : linearization) {
            if (definition.errorHandler != null) {
                return definition.errorHandler;
            }
        }
        return null;
    }

    /** The nearest object factory in linearization order, or {@code null}. */
    public ObjectFactory effectiveObjectFactory() {
        for (SchemaDefinition definition : linearization) {
            if (definition.objectFactory != null) {
                return definition.objectFactory;
            }
        }
        return null;
    }

    // --- instances ---

    /** Creates a schema instance with default settings. */
    public Schema newSchema() {
        return newSchema(SchemaSettings.defaults());
    }

    /** Creates a schema instance with the given settings. */
    public Schema newSchema(SchemaSettings settings) {
        return factory.create(this, settings);
    }

    @Override
    public String toString() {
        return "SchemaDefinition[" + name + ", fields=" + fields.keySet() + "]";
    }

    /** Builder for {@link SchemaDefinition}. */
    public static final class Builder {

        private final String name;
        private final Class<? extends Schema> type;
        private final SchemaFactory<? extends Schema> factory;
        private final List<SchemaDefinition> parents = new ArrayList<>();
        private final Map<String, Field> fields = new LinkedHashMap<>();
        private SchemaOptions options;
        private final List<SchemaValidator> validators = new ArrayList<>();
        private final List<Preprocessor> preprocessors = new ArrayList<>();
        private final List<DataHandler> dataHandlers = new ArrayList<>();
        private final List<AttributeAccessor> accessors = new ArrayList<>();
        private ErrorHandler errorHandler;
        private ObjectFactory objectFactory;
        private SchemaRegistry registry = SchemaRegistry.defaultRegistry();

        private Builder(String name, Class<? extends Schema> type, SchemaFactory<? extends Schema> factory) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("schema name must not be null or empty");
            }
            this.name = name;
            this.type = type;
            this.factory = Objects.requireNonNull(factory, "factory must not be null");
        }

        /**
         * Inherits from {@code parents}, in precedence order.
         *
         * @return this builder (fluent)
         */
        public Builder extend(SchemaDefinition... parents) {
            for (SchemaDefinition parent : parents) {
                this.parents.add(Objects.requireNonNull(parent, "parent must not be null"));
            }
            return this;
        }

        /**
         * Declares a field. Redeclaring a name replaces the earlier field in its position.
         *
         * @return this builder (fluent)
         */
        public Builder field(String fieldName, Field field) {
            if (field == null) {
                throw new InvalidFieldDeclarationException(
                        "Field '" + fieldName + "' must be declared as a Field instance, got: null", name, fieldName);
            }
            fields.put(fieldName, field);
            return this;
        }

        /**
         * Declares fields from a loosely typed mapping, in its iteration order.
         *
         * @throws InvalidFieldDeclarationException if a value is not a {@link Field} instance
         * @return this builder (fluent)
         */
        public Builder fields(Map<String, ?> declarations) {
            for (Map.Entry<String, ?> entry : declarations.entrySet()) {
                Object value = entry.getValue();
                if (!(value instanceof Field)) {
                    String got = value instanceof Class ? ((Class<?>) value).getName() + " (a class)" : String.valueOf(value);
                    throw new InvalidFieldDeclarationException(
                            "Field '" + entry.getKey() + "' must be declared as a Field instance, got: " + got,
                            name,
                            entry.getKey());
                }
                fields.put(entry.getKey(), (Field) value);
            }
            return this;
        }

        /** @return this builder (fluent) */
        public Builder options(SchemaOptions options) {
            this.options = options;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder validator(SchemaValidator validator) {
            validators.add(Objects.requireNonNull(validator, "validator must not be null"));
            return this;
        }

        /** @return this builder (fluent) */
        public Builder preprocessor(Preprocessor preprocessor) {
            preprocessors.add(Objects.requireNonNull(preprocessor, "preprocessor must not be null"));
            return this;
        }

        /** @return this builder (fluent) */
        public Builder dataHandler(DataHandler handler) {
            dataHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
            return this;
        }

        /** @return this builder (fluent) */
        public Builder errorHandler(ErrorHandler handler) {
            this.errorHandler = handler;
            return this;
        }

        /** @return this builder (fluent) */
        public Builder objectFactory(ObjectFactory factory) {
            this.objectFactory = factory;
            return this;
        }

        /**
         * Adds an attribute accessor consulted before the built-in map and bean accessors.
         *
         * @return this builder (fluent)
         */
        public Builder accessor(AttributeAccessor accessor) {
            accessors.add(Objects.requireNonNull(accessor, "accessor must not be null"));
            return this;
        }

        /**
         * Registry the definition registers itself in and resolves nested names against. Defaults
         * to {@link SchemaRegistry#defaultRegistry()}.
         *
         * @return this builder (fluent)
         */
        public Builder registry(SchemaRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        /**
         * Builds and registers the definition.
         *
         * @throws InvalidHierarchyException if the parents cannot be linearized
         */
        public SchemaDefinition build() {
            SchemaDefinition definition = new SchemaDefinition(this);
            registry.register(definition);
            LOG.debug(
                    "Built schema definition '{}' (parents={}, fields={})",
                    definition.name,
                    names(definition.parents),
                    definition.fields.keySet());
            return definition;
        }
    }
}
