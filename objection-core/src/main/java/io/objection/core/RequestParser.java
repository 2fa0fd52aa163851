package io.objection.core;

import io.objection.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Parses the inbound batch document.
 *
 * <p>Expected shape:
 * <pre>{@code
 * { "sessionId": "...",
 *   "events": [ { "key": { "eventPath": ["...", ...] }, "data": <any> }, ... ] }
 * }</pre>
 * Unknown fields are ignored. Every event must carry {@code data}; an explicit {@code null} is a payload.
 */
final class RequestParser {
    private RequestParser() {}

    static RawRequest parse(JsonNode body, int maxEvents) throws RequestException {
        if (body == null || !body.isObject()) {
            throw new RequestException("expected a JSON object at the top level");
        }

        JsonNode sessionId = body.get(Protocol.F_SESSION_ID);
        if (sessionId == null) {
            throw new RequestException("missing field `" + Protocol.F_SESSION_ID + "`");
        }
        if (!sessionId.isTextual()) {
            throw new RequestException("`" + Protocol.F_SESSION_ID + "` must be a string");
        }

        JsonNode events = body.get(Protocol.F_EVENTS);
        if (events == null) {
            throw new RequestException("missing field `" + Protocol.F_EVENTS + "`");
        }
        if (!events.isArray()) {
            throw new RequestException("`" + Protocol.F_EVENTS + "` must be an array");
        }
        if (events.size() > maxEvents) {
            throw new RequestException("too many events: " + events.size() + " (limit " + maxEvents + ")");
        }

        List<RawEvent> parsed = new ArrayList<>(events.size());
        int index = 0;
        for (Iterator<JsonNode> it = events.elements(); it.hasNext(); index++) {
            parsed.add(parseEvent(it.next(), index));
        }
        return new RawRequest(sessionId.asText(), parsed);
    }

    private static RawEvent parseEvent(JsonNode event, int index) throws RequestException {
        String where = Protocol.F_EVENTS + "[" + index + "]";
        if (!event.isObject()) {
            throw new RequestException(where + " must be an object");
        }

        JsonNode key = event.get(Protocol.F_KEY);
        if (key == null || !key.isObject()) {
            throw new RequestException(where + ": missing or invalid field `" + Protocol.F_KEY + "`");
        }
        JsonNode path = key.get(Protocol.F_EVENT_PATH);
        if (path == null || !path.isArray()) {
            throw new RequestException(where + ".key: missing or invalid field `" + Protocol.F_EVENT_PATH + "`");
        }

        List<String> segments = new ArrayList<>(path.size());
        for (Iterator<JsonNode> it = path.elements(); it.hasNext(); ) {
            JsonNode segment = it.next();
            if (!segment.isTextual() || segment.asText().isEmpty()) {
                throw new RequestException(where + ".key.eventPath: segments must be non-empty strings");
            }
            segments.add(segment.asText());
        }

        JsonNode data = event.get(Protocol.F_DATA);
        if (data == null) {
            throw new RequestException(where + ": missing field `" + Protocol.F_DATA + "`");
        }
        return new RawEvent(EventPath.ofSegments(segments), data);
    }
}
