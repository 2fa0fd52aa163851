package io.objection.json.spi;

/**
 * Mutable JSON array node builder.
 */
public interface ArrayNode extends JsonNode {

    ArrayNode add(String value);

    /**
     * Adds a JsonNode value. A {@code null} argument adds a JSON null.
     */
    ArrayNode add(JsonNode value);

    /**
     * Adds every element of the given nodes, in iteration order.
     */
    ArrayNode addAll(Iterable<? extends JsonNode> values);
}
