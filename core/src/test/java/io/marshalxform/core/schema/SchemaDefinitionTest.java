package io.marshalxform.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.marshalxform.core.error.InvalidFieldDeclarationException;
import io.marshalxform.core.error.InvalidHierarchyException;
import io.marshalxform.core.field.InferredField;
import io.marshalxform.core.field.IntegerField;
import io.marshalxform.core.field.StringField;
import io.marshalxform.core.spi.DataHandler;
import io.marshalxform.core.spi.ErrorHandler;
import io.marshalxform.core.spi.SchemaValidator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SchemaDefinitionTest {

    private final SchemaRegistry registry = new SchemaRegistry();

    private SchemaDefinition.Builder builder(String name) {
        return SchemaDefinition.builder(name).registry(registry);
    }

    @Nested
    @DisplayName("inheritance")
    class Inheritance {

        @Test
        void diamondMergesFieldsBaseFirst() {
            SchemaDefinition a = builder("A").field("a", new StringField()).build();
            SchemaDefinition b = builder("B").extend(a).field("b", new StringField()).build();
            SchemaDefinition c = builder("C").extend(a).field("c", new StringField()).build();
            SchemaDefinition d = builder("D").extend(b, c).field("d", new StringField()).build();

            assertThat(d.linearization()).containsExactly(d, b, c, a);
            assertThat(d.fields().keySet()).containsExactly("a", "c", "b", "d");
        }

        @Test
        void redeclaredFieldKeepsBasePosition() {
            SchemaDefinition base = builder("Base")
                    .field("id", new IntegerField())
                    .field("name", new StringField())
                    .build();
            IntegerField override = new IntegerField();
            SchemaDefinition child = builder("Child").extend(base).field("id", override).build();

            assertThat(child.fields().keySet()).containsExactly("id", "name");
            assertThat(child.fields().get("id")).isSameAs(override);
            assertThat(base.fields().get("id")).isNotSameAs(override);
        }

        @Test
        void inconsistentHierarchyIsRejected() {
            SchemaDefinition x = builder("X").build();
            SchemaDefinition y = builder("Y").extend(x).build();

            assertThatThrownBy(() -> builder("Z").extend(x, y).build())
                    .isInstanceOf(InvalidHierarchyException.class)
                    .hasMessageContaining("[X, Y]");
        }

        @Test
        void optionsComeFromNearestDeclaringDefinition() {
            SchemaOptions strict = SchemaOptions.builder().strict(true).build();
            SchemaDefinition base = builder("StrictBase").options(strict).build();
            SchemaDefinition child = builder("Child").extend(base).build();
            SchemaDefinition relaxed = builder("Relaxed")
                    .extend(base)
                    .options(SchemaOptions.defaults())
                    .build();

            assertThat(child.options().strict()).isTrue();
            assertThat(relaxed.options().strict()).isFalse();
        }

        @Test
        void hooksAccumulateBaseFirst() {
            SchemaValidator first = SchemaValidator.named("first", (s, d) -> true);
            SchemaValidator second = SchemaValidator.named("second", (s, d) -> true);
            ErrorHandler baseHandler = (s, e, o) -> {};
            ErrorHandler childHandler = (s, e, o) -> {};
            SchemaDefinition base = builder("HookBase").validator(first).errorHandler(baseHandler).build();
            SchemaDefinition child = builder("HookChild").extend(base).validator(second).build();

            assertThat(child.effectiveValidators()).containsExactly(first, second);
            assertThat(child.effectiveErrorHandler()).isSameAs(baseHandler);

            child.setErrorHandler(childHandler);
            assertThat(child.effectiveErrorHandler()).isSameAs(childHandler);
        }

        @Test
        void hooksRegisteredAfterBuildApplyToNewInstances() {
            SchemaDefinition definition = builder("LateHooks").field("name", new StringField()).build();
            DataHandler handler = (schema, data, original) -> data;

            Schema before = definition.newSchema();
            definition.registerDataHandler(handler);

            assertThat(before.dataHandlers()).isEmpty();
            assertThat(definition.newSchema().dataHandlers()).containsExactly(handler);
        }
    }

    @Nested
    @DisplayName("field options")
    class FieldOptions {

        @Test
        void fieldsOptionFixesExactOrderAndInfersUndeclared() {
            SchemaDefinition definition = builder("Exact")
                    .options(SchemaOptions.builder().fields("email", "name").build())
                    .field("name", new StringField())
                    .field("age", new IntegerField())
                    .build();

            assertThat(definition.fields().keySet()).containsExactly("email", "name");
            assertThat(definition.fields().get("email")).isInstanceOf(InferredField.class);
            assertThat(definition.fields().get("name")).isInstanceOf(StringField.class);
        }

        @Test
        void additionalOptionAppendsInferredFields() {
            SchemaDefinition definition = builder("Additional")
                    .options(SchemaOptions.builder().additional("name", "email").build())
                    .field("name", new StringField())
                    .build();

            assertThat(definition.fields().keySet()).containsExactly("name", "email");
            assertThat(definition.fields().get("name")).isInstanceOf(StringField.class);
        }

        @Test
        void excludeOptionRemovesFields() {
            SchemaDefinition definition = builder("Excluding")
                    .options(SchemaOptions.builder().exclude("age").build())
                    .field("name", new StringField())
                    .field("age", new IntegerField())
                    .build();

            assertThat(definition.fields().keySet()).containsExactly("name");
            assertThat(definition.declaredFields()).containsKey("age");
        }
    }

    @Nested
    @DisplayName("declaration errors")
    class DeclarationErrors {

        @Test
        void nonFieldDeclarationIsRejected() {
            Map<String, Object> declarations = new LinkedHashMap<>();
            declarations.put("name", new StringField());
            declarations.put("email", StringField.class);

            assertThatThrownBy(() -> builder("Broken").fields(declarations))
                    .isInstanceOfSatisfying(InvalidFieldDeclarationException.class, e -> {
                        assertThat(e.fieldName()).isEqualTo("email");
                        assertThat(e.schemaName()).isEqualTo("Broken");
                        assertThat(e.getMessage())
                                .startsWith("Field 'email' must be declared as a Field instance, got: ");
                    });
        }

        @Test
        void nullFieldIsRejected() {
            assertThatThrownBy(() -> builder("Broken").field("name", null))
                    .isInstanceOf(InvalidFieldDeclarationException.class);
        }

        @Test
        void emptyNameIsRejected() {
            assertThatThrownBy(() -> SchemaDefinition.builder("")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void buildRegistersDefinition() {
        SchemaDefinition definition = builder("Registered").build();

        assertThat(registry.find("Registered")).containsSame(definition);
        assertThat(definition.registry()).isSameAs(registry);
        assertThat(definition.parents()).isEmpty();
        assertThat(definition.type()).isEqualTo(Schema.class);
        assertThat(definition).hasToString("SchemaDefinition[Registered, fields=[]]");
    }
}
