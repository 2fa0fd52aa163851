package io.objection.json.spi;

/**
 * Mutable JSON object node builder.
 */
public interface ObjectNode extends JsonNode {

    /**
     * Sets a string field. A {@code null} value is written as JSON null.
     */
    ObjectNode put(String fieldName, String value);

    /**
     * Sets a JsonNode field. A {@code null} value is written as JSON null.
     */
    ObjectNode set(String fieldName, JsonNode value);

    /**
     * Creates a new object node and sets it as a field.
     */
    ObjectNode putObject(String fieldName);

    /**
     * Creates a new array node and sets it as a field.
     */
    ArrayNode putArray(String fieldName);
}
