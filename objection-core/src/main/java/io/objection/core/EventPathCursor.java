package io.objection.core;

import java.util.Objects;

/**
 * Sequential reader over the segments of an incoming {@link EventPath}.
 *
 * <p>Not thread-safe; each handler obtains its own cursor from {@link Client#eventPathCursor()}.
 */
public final class EventPathCursor {

    private final EventPath path;
    private final SymbolCodec codec;
    private int position;

    EventPathCursor(EventPath path, SymbolCodec codec) {
        this.path = Objects.requireNonNull(path, "path");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public boolean hasNext() {
        return position < path.size();
    }

    public int remaining() {
        return path.size() - position;
    }

    /**
     * Returns the next segment without decoding it.
     */
    public Symbol nextSymbol() throws EventPathException {
        if (!hasNext()) {
            throw new EventPathException.NoSymbolsLeft(path);
        }
        return path.get(position++);
    }

    /**
     * Decodes the next segment as {@code type}. The cursor advances even when decoding fails.
     */
    public <S> S nextValue(Class<S> type) throws EventPathException {
        Symbol symbol = nextSymbol();
        try {
            return codec.decode(symbol, type);
        } catch (SymbolCodecException e) {
            throw new EventPathException.InvalidSymbol(e);
        }
    }

    /**
     * Consumes the next segment if it equals {@code literal}.
     *
     * @return true if the segment matched and was consumed
     */
    public boolean skipIf(String literal) {
        if (hasNext() && path.get(position).value().equals(literal)) {
            position++;
            return true;
        }
        return false;
    }
}
