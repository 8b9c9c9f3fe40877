package io.marshalxform.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.marshalxform.core.codec.JacksonSchemaCodec;
import io.marshalxform.core.error.InvalidOptionException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SchemaOptionsTest {

    @Test
    void defaults() {
        SchemaOptions options = SchemaOptions.defaults();

        assertThat(options.fields()).isNull();
        assertThat(options.additional()).isNull();
        assertThat(options.exclude()).isEmpty();
        assertThat(options.dateformat()).isNull();
        assertThat(options.skipMissing()).isFalse();
        assertThat(options.strict()).isFalse();
        assertThat(options.codec()).isSameAs(JacksonSchemaCodec.json());
    }

    @Test
    void fieldsAndAdditionalAreMutuallyExclusive() {
        assertThatThrownBy(() -> SchemaOptions.builder()
                        .schemaName("UserSchema")
                        .fields("name")
                        .additional("email")
                        .build())
                .isInstanceOf(InvalidOptionException.class)
                .hasMessage("Cannot set both 'fields' and 'additional' options on the same schema")
                .extracting(e -> ((InvalidOptionException) e).schemaName())
                .isEqualTo("UserSchema");
    }

    @Test
    void fromMapReadsEveryKey() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("additional", List.of("email"));
        raw.put("exclude", List.of("password"));
        raw.put("dateformat", "rfc");
        raw.put("skip-missing", true);
        raw.put("strict", true);
        raw.put("codec", "yaml");

        SchemaOptions options = SchemaOptions.fromMap(raw, "UserSchema");

        assertThat(options.additional()).containsExactly("email");
        assertThat(options.exclude()).containsExactly("password");
        assertThat(options.dateformat()).isEqualTo("rfc");
        assertThat(options.skipMissing()).isTrue();
        assertThat(options.strict()).isTrue();
        assertThat(options.codec()).isSameAs(JacksonSchemaCodec.yaml());
    }

    @Test
    void nameListOptionMustBeSequence() {
        assertThatThrownBy(() -> SchemaOptions.fromMap(Map.of("fields", "name"), "UserSchema"))
                .isInstanceOf(InvalidOptionException.class)
                .hasMessage("'fields' option must be a list of field names, got: name");
    }

    @Test
    void unknownOptionIsRejected() {
        assertThatThrownBy(() -> SchemaOptions.fromMap(Map.of("ordered", true), "UserSchema"))
                .isInstanceOf(InvalidOptionException.class)
                .hasMessageStartingWith("Unknown schema option 'ordered'");
    }

    @Test
    void wronglyTypedOptionIsRejected() {
        assertThatThrownBy(() -> SchemaOptions.fromMap(Map.of("strict", "yes"), "UserSchema"))
                .isInstanceOf(InvalidOptionException.class)
                .hasMessage("'strict' option must be a boolean, got: yes");
        assertThatThrownBy(() -> SchemaOptions.fromMap(Map.of("codec", "xml"), "UserSchema"))
                .isInstanceOf(InvalidOptionException.class);
    }
}
