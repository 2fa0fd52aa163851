package io.objection.json.spi;

/**
 * Canonical compact binary encoding of the same data model a {@link JsonCodec} handles.
 *
 * <p>Encoding is deterministic: equal values produce equal bytes. The bytes carry no type tag,
 * so {@link #readBinary(byte[], Class)} trusts the caller to name the type that was written.
 */
public interface BinaryCodec {

    /**
     * Serializes a value to its compact binary form.
     * @throws JsonException if serialization fails
     */
    byte[] writeBinary(Object value) throws JsonException;

    /**
     * Deserializes binary data as the given type.
     * @throws JsonException if the bytes are not a valid encoding of {@code type}
     */
    <T> T readBinary(byte[] data, Class<T> type) throws JsonException;
}
