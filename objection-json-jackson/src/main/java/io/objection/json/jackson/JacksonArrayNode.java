package io.objection.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.objection.json.spi.ArrayNode;
import io.objection.json.spi.JsonNode;

/**
 * Jackson implementation of ArrayNode.
 */
final class JacksonArrayNode extends JacksonJsonNode implements ArrayNode {
    private final com.fasterxml.jackson.databind.node.ArrayNode arrayDelegate;

    JacksonArrayNode(com.fasterxml.jackson.databind.node.ArrayNode delegate, ObjectMapper mapper) {
        super(delegate, mapper);
        this.arrayDelegate = delegate;
    }

    @Override
    public ArrayNode add(String value) {
        arrayDelegate.add(value);
        return this;
    }

    @Override
    public ArrayNode add(JsonNode value) {
        arrayDelegate.add(JacksonJsonNode.unwrap(value, mapper));
        return this;
    }

    @Override
    public ArrayNode addAll(Iterable<? extends JsonNode> values) {
        for (JsonNode value : values) {
            add(value);
        }
        return this;
    }
}
