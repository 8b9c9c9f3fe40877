package io.marshalxform.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.marshalxform.core.spi.SchemaCodec;
import java.io.IOException;
import java.util.Objects;

/**
 * {@link SchemaCodec} backed by a Jackson {@link ObjectMapper}. Decoding yields {@link
 * java.util.LinkedHashMap}s, lists and scalars, so key order survives a round trip.
 *
 * <p>Thread-safe: the mapper is configured once and never changed.
 */
public final class JacksonSchemaCodec implements SchemaCodec {

    private static final JacksonSchemaCodec JSON = new JacksonSchemaCodec("json", new ObjectMapper());
    private static final JacksonSchemaCodec YAML = new JacksonSchemaCodec("yaml", new ObjectMapper(new YAMLFactory()));

    private final String format;
    private final ObjectMapper mapper;

    private JacksonSchemaCodec(String format, ObjectMapper mapper) {
        this.format = format;
        this.mapper = mapper.copy().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /** JSON codec; the default for every schema. */
    public static JacksonSchemaCodec json() {
        return JSON;
    }

    /** YAML codec. */
    public static JacksonSchemaCodec yaml() {
        return YAML;
    }

    /** Codec using a caller-configured mapper, e.g. one with extra modules registered. */
    public static JacksonSchemaCodec of(String format, ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return new JacksonSchemaCodec(Objects.requireNonNull(format, "format must not be null"), mapper);
    }

    public String format() {
        return format;
    }

    @Override
    public byte[] encode(Object data) {
        try {
            return mapper.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode data as " + format + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Object decode(byte[] payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        try {
            return mapper.readValue(payload, Object.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot decode " + format + " payload: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "JacksonSchemaCodec[" + format + "]";
    }
}
