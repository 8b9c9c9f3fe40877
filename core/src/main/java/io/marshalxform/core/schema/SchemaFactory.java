package io.marshalxform.core.schema;

/**
 * Creates instances of a {@link Schema} subclass, typically a constructor reference such as {@code
 * UserSchema::new}. Needed for definitions whose schemas carry methods used by method fields.
 */
@FunctionalInterface
public interface SchemaFactory<S extends Schema> {

    S create(SchemaDefinition definition, SchemaSettings settings);
}
