package io.marshalxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.marshalxform.core.error.ConversionException;
import io.marshalxform.core.error.ImplicitCollectionException;
import io.marshalxform.core.error.MarshallingException;
import io.marshalxform.core.error.ValidationException;
import io.marshalxform.core.field.StringField;
import io.marshalxform.core.model.MarshalResult;
import io.marshalxform.core.model.SchemaResult;
import io.marshalxform.core.schema.Schema;
import io.marshalxform.core.schema.SchemaDefinition;
import io.marshalxform.core.schema.SchemaOptions;
import io.marshalxform.core.schema.SchemaRegistry;
import io.marshalxform.core.schema.SchemaSettings;
import io.marshalxform.core.testkit.Schemas;
import io.marshalxform.core.testkit.User;
import io.marshalxform.core.testkit.UserSchema;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarshallerTest {

    private final SchemaRegistry registry = new SchemaRegistry();

    @Nested
    @DisplayName("single records")
    class SingleRecords {

        @Test
        void dumpsEveryFieldInDeclaredOrder() {
            User user = new User("Monty", 42).setEmail("monty@python.org").setHomepage("http://monty.python.org/");

            MarshalResult result = UserSchema.create().dump(user);

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.dataAsMap().keySet())
                    .containsExactly(
                            "name",
                            "age",
                            "email",
                            "homepage",
                            "created",
                            "birthdate",
                            "time_registered",
                            "since_created",
                            "uid",
                            "sex",
                            "balance",
                            "is_old",
                            "lowername");
            assertThat(result.dataAsMap())
                    .containsEntry("name", "Monty")
                    .containsEntry("age", 42.0)
                    .containsEntry("email", "monty@python.org")
                    .containsEntry("created", "2013-11-10T14:20:58Z")
                    .containsEntry("birthdate", "1985-03-14")
                    .containsEntry("time_registered", "01:02:03.456")
                    .containsEntry("since_created", 86430L)
                    .containsEntry("uid", "8c4f0fa2-97a4-4fd8-b3c1-5e0c3a6f1a42")
                    .containsEntry("balance", "100.00")
                    .containsEntry("is_old", false)
                    .containsEntry("lowername", "monty");
        }

        @Test
        void nullAttributesProduceDefaults() {
            Schema schema = Schemas.person(registry).newSchema();
            Map<String, Object> source = new HashMap<>();
            source.put("name", "Monty");
            source.put("age", null);

            assertThat(schema.dump(source).dataAsMap()).containsEntry("age", 0);
        }

        @Test
        void nullSourceDumpsDefaults() {
            Map<String, Object> data = Schemas.person(registry).newSchema().dump(null).dataAsMap();

            assertThat(data).containsEntry("name", "").containsEntry("age", 0);
        }

        @Test
        void failingFieldIsOmittedAndOthersStillDump() {
            User user = new User("Monty", 42).setEmail("johnexample.com");
            user.setBirthdate("foo");

            MarshalResult result = UserSchema.create().dump(user);

            assertThat(result.messages("email")).containsExactly("\"johnexample.com\" is not a valid email address.");
            assertThat(result.messages("birthdate")).containsExactly("'foo' cannot be formatted as a date.");
            assertThat(result.dataAsMap()).doesNotContainKeys("email", "birthdate").containsEntry("name", "Monty");
        }

        @Test
        void badNumberIsReported() {
            MarshalResult result = UserSchema.create().dump(new User("Monty", "badage"));

            assertThat(result.errors()).containsKey("age");
            assertThat(result.dataAsMap()).doesNotContainKey("age");
        }

        @Test
        void singleSchemaRejectsSequences() {
            Schema schema = Schemas.person(registry).newSchema();

            assertThatThrownBy(() -> schema.dump(List.of(new User("Monty"))))
                    .isInstanceOf(ImplicitCollectionException.class)
                    .hasMessageContaining("many=true");
        }

        @Test
        void dumpsReturnsEncodedBytes() {
            Schema schema = Schemas.person(registry).newSchema();

            MarshalResult result = schema.dumps(new User("Monty", 42));

            assertThat(new String(result.dataAs(byte[].class), StandardCharsets.UTF_8))
                    .isEqualTo("{\"name\":\"Monty\",\"age\":42}");
        }
    }

    @Nested
    @DisplayName("many-mode")
    class ManyMode {

        private final Schema schema =
                Schemas.person(registry).newSchema(SchemaSettings.builder().many(true).build());

        @Test
        void dumpsEachElement() {
            List<Object> data = schema.dump(List.of(new User("Mick", 123), new User("Keith", 456))).dataAsList();

            assertThat(data).hasSize(2);
            assertThat(data.get(1)).isEqualTo(Map.of("name", "Keith", "age", 456));
        }

        @Test
        void acceptsStreamsAndArrays() {
            assertThat(schema.dump(Stream.of(new User("Mick"))).dataAsList()).hasSize(1);
            assertThat(schema.dump(new Object[] {new User("Mick"), new User("Keith")}).dataAsList())
                    .hasSize(2);
        }

        @Test
        void errorsAreKeyedByIndex() {
            MarshalResult result = schema.dump(List.of(new User("Mick", 1), new User("Keith", "old")));

            assertThat(result.errors()).containsOnlyKeys(1);
            assertThat(result.nestedErrors(1)).containsKey("age");
            assertThat(result.dataAsList()).hasSize(2);
        }

        @Test
        void nullInputDumpsEmptyList() {
            assertThat(schema.dump(null).dataAsList()).isEmpty();
        }

        @Test
        void nonSequenceInputIsSchemaError() {
            MarshalResult result = schema.dump(new User("Mick"));

            assertThat(result.messages(SchemaResult.SCHEMA_ERRORS_KEY)).containsExactly("Invalid input type.");
        }
    }

    @Nested
    @DisplayName("options and settings")
    class OptionsAndSettings {

        @Test
        void skipMissingOmitsNullAndAbsentAttributes() {
            SchemaDefinition definition = SchemaDefinition.builder("SkipMissing")
                    .registry(registry)
                    .options(SchemaOptions.builder().skipMissing(true).build())
                    .field("name", new StringField())
                    .field("email", new StringField())
                    .field("nickname", new StringField())
                    .build();
            Map<String, Object> source = new HashMap<>();
            source.put("name", "Monty");
            source.put("email", null);

            assertThat(definition.newSchema().dump(source).dataAsMap()).containsOnlyKeys("name");
        }

        @Test
        void prefixAppliesToOutputKeys() {
            Schema schema = Schemas.person(registry).newSchema(SchemaSettings.builder().prefix("usr_").build());

            assertThat(schema.dump(new User("Monty", 42)).dataAsMap()).containsOnlyKeys("usr_name", "usr_age");
        }

        @Test
        void extraIsOverlaidLast() {
            Schema schema = Schemas.person(registry)
                    .newSchema(SchemaSettings.builder()
                            .extra(Map.of("source", "import", "age", -1))
                            .build());

            Map<String, Object> data = schema.dump(new User("Monty", 42)).dataAsMap();

            assertThat(data).containsEntry("source", "import").containsEntry("age", -1);
        }

        @Test
        void attributeReadsFromOtherNameAndDottedPath() {
            SchemaDefinition definition = SchemaDefinition.builder("Attributes")
                    .registry(registry)
                    .field("full_name", new StringField().attribute("name"))
                    .field("employer_name", new StringField().attribute("employer.name"))
                    .build();
            User user = new User("Monty").setEmployer(new User("Joe"));

            assertThat(definition.newSchema().dump(user).dataAsMap())
                    .containsEntry("full_name", "Monty")
                    .containsEntry("employer_name", "Joe");
        }

        @Test
        void inferredFieldFailsForUnknownAttribute() {
            SchemaDefinition definition = SchemaDefinition.builder("Inferred")
                    .registry(registry)
                    .options(SchemaOptions.builder().fields("name", "nickname").build())
                    .build();

            assertThatThrownBy(() -> definition.newSchema().dump(new User("Monty")))
                    .hasMessage("'User' object has no attribute 'nickname'");
        }

        @Test
        void inferredFieldDumpsNullForPresentNullAttribute() {
            SchemaDefinition definition = SchemaDefinition.builder("InferredNulls")
                    .registry(registry)
                    .options(SchemaOptions.builder().fields("name", "email").build())
                    .build();

            MarshalResult result = definition.newSchema().dump(new User("Monty"));

            assertThat(result.hasErrors()).isFalse();
            assertThat(result.dataAsMap()).containsEntry("name", "Monty").containsEntry("email", null);
        }

        @Test
        void inferredFieldFormatsByRuntimeType() {
            SchemaDefinition definition = SchemaDefinition.builder("InferredTypes")
                    .registry(registry)
                    .options(SchemaOptions.builder().fields("name", "created", "uid").build())
                    .build();

            Map<String, Object> data = definition.newSchema().dump(new User("Monty")).dataAsMap();

            assertThat(data)
                    .containsEntry("created", "2013-11-10T14:20:58Z")
                    .containsEntry("uid", "8c4f0fa2-97a4-4fd8-b3c1-5e0c3a6f1a42");
        }
    }

    @Nested
    @DisplayName("data handlers")
    class DataHandlers {

        @Test
        void handlersRunInOrderOnEachRecord() {
            SchemaDefinition definition = SchemaDefinition.builder("Handled")
                    .registry(registry)
                    .field("name", new StringField())
                    .dataHandler((schema, data, original) -> {
                        data.put("kind", ((User) original).getClass().getSimpleName());
                        return data;
                    })
                    .dataHandler((schema, data, original) -> {
                        Map<String, Object> root = new LinkedHashMap<>();
                        root.put("user", data);
                        return root;
                    })
                    .build();

            Map<String, Object> data = definition.newSchema().dump(new User("Monty")).dataAsMap();

            assertThat(data).isEqualTo(Map.of("user", Map.of("name", "Monty", "kind", "User")));
        }

        @Test
        void handlerConversionErrorIsSchemaError() {
            SchemaDefinition definition = SchemaDefinition.builder("HandlerFailure")
                    .registry(registry)
                    .field("name", new StringField())
                    .dataHandler((schema, data, original) -> {
                        throw new ValidationException("Cannot envelope record.");
                    })
                    .build();

            MarshalResult result = definition.newSchema().dump(new User("Monty"));

            assertThat(result.messages(SchemaResult.SCHEMA_ERRORS_KEY)).containsExactly("Cannot envelope record.");
            assertThat(result.dataAsMap()).containsEntry("name", "Monty");
        }
    }

    @Nested
    @DisplayName("strict mode")
    class StrictMode {

        @Test
        void strictSchemaRaisesOnFirstFieldError() {
            Schema schema = UserSchema.create(SchemaSettings.builder().strict(true).build());
            User user = new User("Monty", 42).setEmail("johnexample.com");

            assertThatThrownBy(() -> schema.dump(user))
                    .isInstanceOfSatisfying(MarshallingException.class, e -> {
                        assertThat(e.getMessage())
                                .isEqualTo("Error dumping field 'email': \"johnexample.com\" is not a valid email address.");
                        assertThat(e.underlyingException()).isInstanceOf(ConversionException.class);
                        assertThat(e.errors()).containsOnlyKeys("email");
                        assertThat(e.schemaName()).isEqualTo("UserSchema");
                    });
        }

        @Test
        void strictSchemaWithoutErrorsDumpsNormally() {
            Schema schema = Schemas.person(registry).newSchema(SchemaSettings.builder().strict(true).build());

            assertThat(schema.dump(new User("Monty", 42)).dataAsMap()).containsEntry("age", 42);
        }
    }
}
