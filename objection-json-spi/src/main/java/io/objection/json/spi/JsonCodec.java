package io.objection.json.spi;

/**
 * Minimal JSON codec interface providing serialization, deserialization and tree construction.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Trees produced by one codec must only be combined with trees produced by the same codec.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object (or a {@link JsonNode}) to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object (or a {@link JsonNode}) to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Tree model =====

    /**
     * Parses JSON bytes to a tree.
     * @throws JsonException if the bytes are not a single valid JSON document
     */
    JsonNode readTree(byte[] data) throws JsonException;

    /**
     * Parses a JSON string to a tree.
     * @throws JsonException if the text is not a single valid JSON document
     */
    JsonNode readTree(String json) throws JsonException;

    /**
     * Converts an arbitrary value to a tree. {@code null} becomes a JSON null node;
     * a {@link JsonNode} produced by this codec is returned as is.
     * @throws JsonException if the value cannot be represented as JSON
     */
    JsonNode valueToTree(Object value) throws JsonException;

    /**
     * Creates an empty object node.
     */
    ObjectNode createObjectNode();

    /**
     * Creates an empty array node.
     */
    ArrayNode createArrayNode();
}
