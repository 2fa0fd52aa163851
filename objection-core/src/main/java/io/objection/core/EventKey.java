package io.objection.core;

import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.JsonException;
import io.objection.json.spi.JsonNode;
import io.objection.json.spi.ObjectNode;
import io.objection.json.spi.TypeRef;

import java.util.List;
import java.util.Objects;

/**
 * Identifies events originating from one UI path and carrying a payload of type {@code T}.
 *
 * <p>The wire form ({@link #toNode(JsonCodec)}) carries only the path and debug symbol. The payload type is
 * held in memory for deserialization and is never checked against what the renderer actually sent beyond
 * what deserialization itself enforces. Generic payloads are declared with a {@link TypeRef}:
 * <pre>{@code
 * EventKey<List<Item>> reorder = ui.eventKey(new TypeRef<List<Item>>() {});
 * }</pre>
 *
 * <p>A handler typically tests several keys against one incoming event:
 * <pre>{@code
 * if (saveKey.matches(client)) {
 *     Draft draft = saveKey.takeData(client);
 *     ...
 * } else if (cancelKey.matches(client)) {
 *     ...
 * }
 * }</pre>
 *
 * @param <T> payload type
 */
public final class EventKey<T> {

    private final EventPath path;
    private final String debugSymbol;
    private final PayloadReader<T> reader;

    @FunctionalInterface
    private interface PayloadReader<T> {
        T read(JsonNode raw) throws JsonException;
    }

    private EventKey(EventPath path, String debugSymbol, PayloadReader<T> reader) {
        this.path = Objects.requireNonNull(path, "path");
        this.debugSymbol = debugSymbol;
        this.reader = reader;
    }

    /**
     * Captures the current path of {@code ui}.
     */
    public static <T> EventKey<T> create(Ui ui, Class<T> payloadType) {
        Objects.requireNonNull(ui, "ui");
        Objects.requireNonNull(payloadType, "payloadType");
        return new EventKey<>(ui.path(), null, raw -> raw.toObject(payloadType));
    }

    /**
     * Captures the current path of {@code ui}, for payloads of a generic type.
     */
    public static <T> EventKey<T> create(Ui ui, TypeRef<T> payloadType) {
        Objects.requireNonNull(ui, "ui");
        Objects.requireNonNull(payloadType, "payloadType");
        return new EventKey<>(ui.path(), null, raw -> raw.toObject(payloadType));
    }

    /**
     * Returns a copy with a label for debugging tools. Matching ignores it.
     */
    public EventKey<T> withDebugSymbol(String label) {
        return new EventKey<>(path, Objects.requireNonNull(label, "label"), reader);
    }

    public EventPath path() {
        return path;
    }

    public String debugSymbol() {
        return debugSymbol;
    }

    /**
     * Copy of the path segments, including the encoded dynamic ones.
     */
    public List<String> dynamicSymbols() {
        return path.segments();
    }

    /**
     * Whether the event being handled by {@code client} originated from this key's path.
     */
    public boolean matches(Client client) {
        return path.equals(client.incomingPath());
    }

    /**
     * Moves the incoming payload out of the session and deserializes it as {@code T}.
     *
     * <p>Succeeds at most once per event. A path mismatch leaves the payload in place for another key.
     *
     * @throws TakeDataException.DifferingEventPaths if the incoming path differs in length or any segment
     * @throws TakeDataException.DataAlreadyTaken if the payload is gone
     * @throws TakeDataException.FailedToDeserialize if the payload is not a {@code T}
     */
    public T takeData(Client client) throws TakeDataException {
        Objects.requireNonNull(client, "client");
        EventPath incoming = client.incomingPath();
        if (!path.equals(incoming)) {
            throw new TakeDataException.DifferingEventPaths(path, incoming);
        }

        JsonNode raw = client.takeEventData();
        if (raw == null) {
            throw new TakeDataException.DataAlreadyTaken();
        }

        try {
            return reader.read(raw);
        } catch (JsonException e) {
            throw new TakeDataException.FailedToDeserialize(e.getMessage(), e);
        }
    }

    /**
     * {@code {"eventPath": [...], "debugSymbol": ...}}, for advertising the key to the renderer.
     */
    public ObjectNode toNode(JsonCodec codec) {
        return ActionNodes.key(codec, Protocol.F_EVENT_PATH, path, debugSymbol);
    }

    @Override
    public String toString() {
        return "EventKey" + path + (debugSymbol == null ? "" : "(" + debugSymbol + ")");
    }
}
