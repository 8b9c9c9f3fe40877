package io.marshalxform.core.schema;

import io.marshalxform.core.error.UnknownSchemaException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of schema definitions by name and by schema type, used to resolve nested fields that
 * refer to their target indirectly. Definitions register themselves when built. Thread-safe:
 * registration and lookup can happen concurrently.
 */
public final class SchemaRegistry {

    private static final SchemaRegistry DEFAULT = new SchemaRegistry();

    private final Map<String, SchemaDefinition> byName = new ConcurrentHashMap<>();
    private final Map<Class<?>, SchemaDefinition> byType = new ConcurrentHashMap<>();

    /** The process-wide registry used by definitions that do not name their own. */
    public static SchemaRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Registers a definition under its name and, if it has one, its schema type. A definition with
     * the same name is replaced (last-write-wins semantics).
     *
     * @param definition the definition to register
     * @throws NullPointerException if definition is null
     */
    public void register(SchemaDefinition definition) {
        if (definition == null) {
            throw new NullPointerException("definition must not be null");
        }
        byName.put(definition.name(), definition);
        if (definition.type() != Schema.class) {
            byType.put(definition.type(), definition);
        }
    }

    /**
     * Looks up a definition by name.
     *
     * @return the definition, or empty if not registered
     */
    public Optional<SchemaDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Looks up a definition by schema type.
     *
     * @return the definition, or empty if not registered
     */
    public Optional<SchemaDefinition> find(Class<?> type) {
        return Optional.ofNullable(byType.get(type));
    }

    /**
     * Looks up a definition by name, throwing if not found.
     *
     * @throws UnknownSchemaException if no definition is registered under {@code name}
     */
    public SchemaDefinition require(String name) {
        return find(name)
                .orElseThrow(() -> new UnknownSchemaException("No schema registered under name '" + name + "'", name, null));
    }

    /** Returns {@code true} if a definition is registered under {@code name}. */
    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** Returns the number of registered definitions. */
    public int size() {
        return byName.size();
    }

    /** Removes every definition. */
    public void clear() {
        byName.clear();
        byType.clear();
    }
}
