package io.objection.core;

import io.objection.json.spi.JsonNode;

import java.util.List;

/**
 * The ordered action log of one handled event, produced by {@link SessionRoot#intoResponse()}.
 */
public final class UiResponse {
    private final List<JsonNode> actions;

    UiResponse(List<JsonNode> actions) {
        this.actions = List.copyOf(actions);
    }

    public List<JsonNode> actions() {
        return actions;
    }
}
