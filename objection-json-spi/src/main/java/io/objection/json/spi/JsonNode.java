package io.objection.json.spi;

import java.util.Iterator;

/**
 * Read access to a parsed JSON value without exposing the underlying JSON library.
 */
public interface JsonNode {

    boolean isObject();

    boolean isArray();

    boolean isTextual();

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     * A field explicitly set to JSON null yields a node, not null.
     */
    JsonNode get(String fieldName);

    /**
     * Gets an element by index from an array node.
     * Returns null if this is not an array or index is out of bounds.
     */
    JsonNode get(int index);

    /**
     * Number of fields of an object or elements of an array; 0 for anything else.
     */
    int size();

    /**
     * The string value of a text node, or the textual form of any other scalar.
     */
    String asText();

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();

    /**
     * Converts this node to a Java object of the specified type.
     * @throws JsonException if conversion fails
     */
    <T> T toObject(Class<T> type) throws JsonException;

    /**
     * Converts this node to a Java object of a generic type, such as {@code List<Item>}.
     * @throws JsonException if conversion fails
     */
    <T> T toObject(TypeRef<T> type) throws JsonException;
}
