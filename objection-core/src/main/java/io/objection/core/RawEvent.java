package io.objection.core;

import io.objection.json.spi.JsonNode;

import java.util.Objects;

/**
 * One event of a request, as sent by the renderer.
 *
 * @param path the path the event originated from
 * @param data the payload; {@code null} only for events built in code without one
 */
public record RawEvent(EventPath path, JsonNode data) {
    public RawEvent {
        Objects.requireNonNull(path, "path");
    }
}
