package io.marshalxform.core.spi;

/**
 * Pluggable encoder/decoder used only by the byte-oriented {@code dumps}/{@code loads} wrappers. The
 * core mapping transform never touches it.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface SchemaCodec {

    /**
     * Encodes dumped data (maps, lists, strings, numbers, booleans, nulls).
     *
     * @throws IllegalArgumentException if the data cannot be encoded
     */
    byte[] encode(Object data);

    /**
     * Decodes a payload into maps, lists and scalars ready for {@code load}.
     *
     * @throws IllegalArgumentException if the payload is malformed
     */
    Object decode(byte[] payload);
}
