package io.objection.core;

import io.objection.json.spi.TypeRef;

import java.util.Objects;

/**
 * Read-only view of a UI scope, used by nested rendering logic to derive {@link EventKey}s.
 *
 * <p>A Ui cannot reach the incoming payload or the action log. Deriving a child scope never changes this
 * view, so siblings can be derived from the same parent in any order.
 */
public final class Ui {

    private final EventPath path;
    private final SymbolCodec codec;

    Ui(EventPath path, SymbolCodec codec) {
        this.path = Objects.requireNonNull(path, "path");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Child scope with {@code symbol} appended verbatim.
     */
    public Ui scope(Symbol symbol) {
        return new Ui(path.append(symbol), codec);
    }

    /**
     * Child scope with the literal segment {@code name}, same as {@code scope(Symbol.literal(name))}.
     */
    public Ui scope(String name) {
        return scope(Symbol.literal(name));
    }

    /**
     * Child scope with {@code value} appended as an encoded dynamic segment, for list items and other
     * data-driven subtrees. Strings are encoded too; use {@link #scope(String)} for a literal name.
     * Read it back with {@link EventPathCursor#nextValue(Class)}.
     */
    public Ui scopeValue(Object value) {
        return new Ui(path.append(codec.encode(value)), codec);
    }

    public EventPath path() {
        return path;
    }

    public <T> EventKey<T> eventKey(Class<T> payloadType) {
        return EventKey.create(this, payloadType);
    }

    public <T> EventKey<T> eventKey(TypeRef<T> payloadType) {
        return EventKey.create(this, payloadType);
    }
}
