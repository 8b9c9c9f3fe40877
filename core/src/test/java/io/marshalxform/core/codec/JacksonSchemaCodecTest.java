package io.marshalxform.core.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonSchemaCodecTest {

    @Test
    void jsonKeepsKeyOrder() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("zeta", 1);
        data.put("alpha", List.of("a", "b"));

        String json = new String(JacksonSchemaCodec.json().encode(data), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("{\"zeta\":1,\"alpha\":[\"a\",\"b\"]}");
    }

    @Test
    @SuppressWarnings("unchecked")
    void jsonDecodesToOrderedMaps() {
        Object decoded = JacksonSchemaCodec.json().decode("{\"b\":1,\"a\":{\"c\":null}}".getBytes(StandardCharsets.UTF_8));

        assertThat(decoded).isInstanceOf(Map.class);
        assertThat(((Map<String, ?>) decoded).keySet()).containsExactly("b", "a");
    }

    @Test
    void yamlRoundTripsScalars() {
        JacksonSchemaCodec yaml = JacksonSchemaCodec.yaml();
        byte[] encoded = yaml.encode(Map.of("name", "Monty"));

        assertThat(new String(encoded, StandardCharsets.UTF_8)).contains("name: \"Monty\"");
        assertThat(yaml.decode(encoded)).isEqualTo(Map.of("name", "Monty"));
        assertThat(yaml.format()).isEqualTo("yaml");
    }

    @Test
    void malformedPayloadIsIllegalArgument() {
        assertThatThrownBy(() -> JacksonSchemaCodec.json().decode("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Cannot decode json payload");
    }

    @Test
    void customMapperIsCopied() {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        JacksonSchemaCodec codec = JacksonSchemaCodec.of("pretty-json", mapper);

        assertThat(new String(codec.encode(Map.of("a", 1)), StandardCharsets.UTF_8)).contains("\n");
        assertThat(codec).hasToString("JacksonSchemaCodec[pretty-json]");
    }
}
