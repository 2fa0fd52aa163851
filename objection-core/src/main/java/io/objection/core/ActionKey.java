package io.objection.core;

import io.objection.json.spi.JsonCodec;
import io.objection.json.spi.ObjectNode;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Addresses a renderer-side slot that accepts values of type {@code T}.
 *
 * <p>Unlike {@link EventKey}, the path does not follow the UI scope: every key gets a single random
 * segment when it is created. The type parameter exists only at compile time.
 *
 * @param <T> payload type
 */
public final class ActionKey<T> {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final EventPath path;
    private final String debugSymbol;

    private ActionKey(EventPath path, String debugSymbol) {
        this.path = path;
        this.debugSymbol = debugSymbol;
    }

    public static <T> ActionKey<T> create() {
        return new ActionKey<>(EventPath.of(Long.toUnsignedString(RANDOM.nextLong())), null);
    }

    /**
     * Returns a copy with the same path and a label for debugging tools.
     */
    public ActionKey<T> withDebugSymbol(String label) {
        return new ActionKey<>(path, Objects.requireNonNull(label, "label"));
    }

    public EventPath path() {
        return path;
    }

    public String debugSymbol() {
        return debugSymbol;
    }

    /**
     * Appends {@code {key, data}} to the action log of the event being handled. Every call adds an entry.
     *
     * @throws IllegalArgumentException if {@code data} cannot be serialized
     */
    public void emit(T data, Client client) {
        Objects.requireNonNull(client, "client");
        client.pushAction(path, debugSymbol, data);
    }

    /**
     * {@code {"actionPath": [...], "debugSymbol": ...}}, for advertising the key to the renderer.
     */
    public ObjectNode toNode(JsonCodec codec) {
        return ActionNodes.key(codec, Protocol.F_ACTION_PATH, path, debugSymbol);
    }

    @Override
    public String toString() {
        return "ActionKey" + path + (debugSymbol == null ? "" : "(" + debugSymbol + ")");
    }
}
