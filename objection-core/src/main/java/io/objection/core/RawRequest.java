package io.objection.core;

import java.util.List;
import java.util.Objects;

/**
 * A parsed batch of renderer events for one session.
 */
public record RawRequest(String sessionId, List<RawEvent> events) {
    public RawRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        events = List.copyOf(events);
    }
}
