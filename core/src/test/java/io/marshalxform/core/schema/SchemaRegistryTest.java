package io.marshalxform.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.marshalxform.core.error.UnknownSchemaException;
import io.marshalxform.core.field.StringField;
import io.marshalxform.core.testkit.UserSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaRegistryTest {

    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry();
    }

    @Test
    void findsByName() {
        SchemaDefinition definition = SchemaDefinition.builder("Author").registry(registry).build();

        assertThat(registry.contains("Author")).isTrue();
        assertThat(registry.require("Author")).isSameAs(definition);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void lastRegistrationWins() {
        SchemaDefinition first = SchemaDefinition.builder("Author").registry(registry).build();
        SchemaDefinition second = SchemaDefinition.builder("Author")
                .registry(registry)
                .field("name", new StringField())
                .build();

        assertThat(registry.require("Author")).isSameAs(second).isNotSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void subclassDefinitionsAreFoundByType() {
        registry.register(UserSchema.DEFINITION);

        assertThat(registry.find(UserSchema.class)).containsSame(UserSchema.DEFINITION);
        assertThat(registry.find(Schema.class)).isEmpty();
    }

    @Test
    void unknownNameFailsWithDefinitionError() {
        assertThatThrownBy(() -> registry.require("Nope"))
                .isInstanceOf(UnknownSchemaException.class)
                .hasMessage("No schema registered under name 'Nope'");
    }

    @Test
    void clearEmptiesRegistry() {
        SchemaDefinition.builder("Author").registry(registry).build();

        registry.clear();

        assertThat(registry.find("Author")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void defaultRegistryHoldsDefinitionsWithoutExplicitRegistry() {
        assertThat(SchemaRegistry.defaultRegistry().find(UserSchema.class)).containsSame(UserSchema.DEFINITION);
        assertThat(SchemaRegistry.defaultRegistry()).isSameAs(SchemaRegistry.defaultRegistry());
    }
}
