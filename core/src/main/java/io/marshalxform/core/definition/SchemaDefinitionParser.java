package io.marshalxform.core.definition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.marshalxform.core.error.InvalidOptionException;
import io.marshalxform.core.error.SchemaDefinitionException;
import io.marshalxform.core.error.SchemaParseException;
import io.marshalxform.core.field.ArbitraryField;
import io.marshalxform.core.field.BooleanField;
import io.marshalxform.core.field.DateField;
import io.marshalxform.core.field.DateTimeField;
import io.marshalxform.core.field.DecimalField;
import io.marshalxform.core.field.EmailField;
import io.marshalxform.core.field.Field;
import io.marshalxform.core.field.FixedField;
import io.marshalxform.core.field.IntegerField;
import io.marshalxform.core.field.ListField;
import io.marshalxform.core.field.LocalDateTimeField;
import io.marshalxform.core.field.NestedField;
import io.marshalxform.core.field.NumberField;
import io.marshalxform.core.field.PriceField;
import io.marshalxform.core.field.RawField;
import io.marshalxform.core.field.SelectField;
import io.marshalxform.core.field.StringField;
import io.marshalxform.core.field.TimeDeltaField;
import io.marshalxform.core.field.TimeField;
import io.marshalxform.core.field.UrlField;
import io.marshalxform.core.field.UuidField;
import io.marshalxform.core.schema.SchemaDefinition;
import io.marshalxform.core.schema.SchemaOptions;
import io.marshalxform.core.schema.SchemaRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML schema definition files into {@link SchemaDefinition}s registered in a {@link
 * SchemaRegistry}.
 *
 * <pre>{@code
 * schema: UserSchema
 * extends: [BaseSchema]
 * options: { exclude: [password], skip-missing: true }
 * fields:
 *   name:     { type: string, required: true }
 *   age:      { type: integer, default: 0 }
 *   employer: { type: nested, schema: self, exclude: [employer] }
 * }</pre>
 *
 * <p>Documents are first validated against the bundled {@code schema-definition.schema.json}
 * (JSON Schema 2020-12). Each field kind then accepts only the keys that apply to it, so typos
 * such as {@code format} on a string field are reported instead of silently ignored. Parents named
 * under {@code extends} must already be registered.
 *
 * <p>Thread-safe.
 */
public final class SchemaDefinitionParser {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDefinitionParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String DEFINITION_SCHEMA_RESOURCE = "/schema-definition.schema.json";
    private static final String SELF = "self";

    /** Keys every field kind accepts. */
    private static final Set<String> COMMON_FIELD_KEYS =
            Set.of("type", "attribute", "default", "required", "allow-null", "error");

    /** Extra keys accepted per field kind. */
    private static final Map<String, Set<String>> KIND_FIELD_KEYS = Map.ofEntries(
            Map.entry("raw", Set.of()),
            Map.entry("string", Set.of()),
            Map.entry("number", Set.of("as-string")),
            Map.entry("integer", Set.of()),
            Map.entry("decimal", Set.of("places", "rounding", "as-string")),
            Map.entry("fixed", Set.of("decimals")),
            Map.entry("price", Set.of()),
            Map.entry("arbitrary", Set.of()),
            Map.entry("boolean", Set.of()),
            Map.entry("datetime", Set.of("format")),
            Map.entry("localdatetime", Set.of("format", "zone")),
            Map.entry("date", Set.of()),
            Map.entry("time", Set.of()),
            Map.entry("timedelta", Set.of()),
            Map.entry("uuid", Set.of()),
            Map.entry("url", Set.of("relative")),
            Map.entry("email", Set.of()),
            Map.entry("select", Set.of("choices")),
            Map.entry("list", Set.of("of")),
            Map.entry("nested", Set.of("schema", "only", "exclude", "many", "flat", "prefix")));

    private final SchemaRegistry registry;
    private final JsonSchema definitionSchema;

    /** Creates a parser registering into {@link SchemaRegistry#defaultRegistry()}. */
    public SchemaDefinitionParser() {
        this(SchemaRegistry.defaultRegistry());
    }

    /**
     * Creates a parser registering into {@code registry}.
     *
     * @param registry registry for resolving parents and registering parsed definitions
     */
    public SchemaDefinitionParser(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.definitionSchema = loadDefinitionSchema();
    }

    public SchemaRegistry registry() {
        return registry;
    }

    /**
     * Parses the YAML file at {@code path}.
     *
     * @throws SchemaParseException if the file cannot be read, is not a valid definition, or
     *     refers to unknown parents or schemas
     */
    public SchemaDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /**
     * Parses a YAML document held in memory.
     *
     * @param yaml   the document text
     * @param source label used in error messages, e.g. a resource name
     */
    public SchemaDefinition parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    private SchemaDefinition parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaParseException("Schema definition must be a YAML mapping", null, source);
        }
        String schemaName = root.path("schema").isTextual() ? root.get("schema").asText() : null;
        validateStructure(root, schemaName, source);

        SchemaDefinition.Builder builder = SchemaDefinition.builder(schemaName).registry(registry);
        for (JsonNode parentName : root.path("extends")) {
            SchemaDefinition parent = registry.find(parentName.asText())
                    .orElseThrow(() -> new SchemaParseException(
                            "Unknown parent schema '" + parentName.asText() + "'", schemaName, source));
            builder.extend(parent);
        }

        try {
            if (root.has("options")) {
                Map<String, Object> options = toMap(root.get("options"));
                builder.options(SchemaOptions.fromMap(options, schemaName));
            }
            for (Map.Entry<String, JsonNode> entry : root.path("fields").properties()) {
                builder.field(entry.getKey(), parseField(entry.getKey(), entry.getValue(), schemaName, source));
            }
            SchemaDefinition definition = builder.build();
            LOG.info(
                    "Loaded schema definition '{}' from {} (fields={})",
                    definition.name(),
                    source,
                    definition.fields().keySet());
            return definition;
        } catch (SchemaParseException | InvalidOptionException e) {
            throw e;
        } catch (SchemaDefinitionException e) {
            throw new SchemaParseException(e.getMessage(), e, schemaName, source);
        }
    }

    private void validateStructure(JsonNode root, String schemaName, String source) {
        Set<ValidationMessage> errors = definitionSchema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.joining("; "));
            throw new SchemaParseException("Invalid schema definition: " + detail, schemaName, source);
        }
    }

    private Field parseField(String fieldName, JsonNode node, String schemaName, String source) {
        String kind = node.get("type").asText();
        rejectUnknownKeys(node, kind, fieldName, schemaName, source);
        Field field;
        try {
            field = createField(kind, fieldName, node, schemaName, source);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new SchemaParseException(
                    "Invalid " + kind + " field '" + fieldName + "': " + e.getMessage(), e, schemaName, source);
        }
        if (node.has("attribute")) {
            field.attribute(node.get("attribute").asText());
        }
        if (node.has("default")) {
            field.defaultValue(toValue(node.get("default")));
        }
        if (node.has("required")) {
            field.required(node.get("required").asBoolean());
        }
        if (node.has("allow-null")) {
            field.allowNull(node.get("allow-null").asBoolean());
        }
        if (node.has("error")) {
            field.error(node.get("error").asText());
        }
        return field;
    }

    private Field createField(String kind, String fieldName, JsonNode node, String schemaName, String source) {
        switch (kind) {
            case "raw":
                return new RawField();
            case "string":
                return new StringField();
            case "number":
                NumberField number = new NumberField();
                return node.path("as-string").asBoolean(false) ? number.asString() : number;
            case "integer":
                return new IntegerField();
            case "decimal":
                DecimalField decimal = new DecimalField(
                        node.has("places") ? node.get("places").asInt() : null,
                        node.has("rounding") ? RoundingMode.valueOf(node.get("rounding").asText()) : null);
                return node.path("as-string").asBoolean(false) ? decimal.asString() : decimal;
            case "fixed":
                return node.has("decimals") ? new FixedField(node.get("decimals").asInt()) : new FixedField();
            case "price":
                return new PriceField();
            case "arbitrary":
                return new ArbitraryField();
            case "boolean":
                return new BooleanField();
            case "datetime":
                return new DateTimeField(textOrNull(node, "format"));
            case "localdatetime":
                ZoneId zone = node.has("zone") ? ZoneId.of(node.get("zone").asText()) : ZoneId.systemDefault();
                return new LocalDateTimeField(textOrNull(node, "format"), zone);
            case "date":
                return new DateField();
            case "time":
                return new TimeField();
            case "timedelta":
                return new TimeDeltaField();
            case "uuid":
                return new UuidField();
            case "url":
                return new UrlField(node.path("relative").asBoolean(false));
            case "email":
                return new EmailField();
            case "select":
                return new SelectField((List<?>) toValue(node.get("choices")));
            case "list":
                if (!node.has("of")) {
                    throw new SchemaParseException(
                            "List field '" + fieldName + "' requires an 'of' field declaration", schemaName, source);
                }
                return new ListField(parseField(fieldName, node.get("of"), schemaName, source));
            case "nested":
                return createNested(fieldName, node, schemaName, source);
            default:
                throw new SchemaParseException(
                        "Unknown field type '" + kind + "' for field '" + fieldName + "'", schemaName, source);
        }
    }

    private NestedField createNested(String fieldName, JsonNode node, String schemaName, String source) {
        if (!node.has("schema")) {
            throw new SchemaParseException(
                    "Nested field '" + fieldName + "' requires a 'schema' reference", schemaName, source);
        }
        String target = node.get("schema").asText();
        NestedField nested = SELF.equals(target) ? NestedField.self() : new NestedField(target);
        if (node.has("only")) {
            nested.only(textList(node.get("only")));
        }
        if (node.has("exclude")) {
            nested.exclude(textList(node.get("exclude")));
        }
        if (node.has("many")) {
            nested.many(node.get("many").asBoolean());
        }
        if (node.has("flat")) {
            nested.flat(node.get("flat").asText());
        }
        if (node.has("prefix")) {
            nested.prefix(node.get("prefix").asText());
        }
        return nested;
    }

    private static void rejectUnknownKeys(
            JsonNode node, String kind, String fieldName, String schemaName, String source) {
        Set<String> allowed = KIND_FIELD_KEYS.getOrDefault(kind, Set.of());
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!COMMON_FIELD_KEYS.contains(key) && !allowed.contains(key)) {
                throw new SchemaParseException(
                        "Unknown key '" + key + "' for " + kind + " field '" + fieldName + "'", schemaName, source);
            }
        }
    }

    private static String textOrNull(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }

    private static Object toValue(JsonNode node) {
        return YAML_MAPPER.convertValue(node, Object.class);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toMap(JsonNode node) {
        return YAML_MAPPER.convertValue(node, Map.class);
    }

    private static JsonSchema loadDefinitionSchema() {
        try (InputStream in = SchemaDefinitionParser.class.getResourceAsStream(DEFINITION_SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFINITION_SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFINITION_SCHEMA_RESOURCE + ": " + e.getMessage(), e);
        }
    }
}
