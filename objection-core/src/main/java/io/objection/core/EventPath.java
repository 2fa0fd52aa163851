package io.objection.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, root-to-leaf sequence of {@link Symbol}s addressing a UI subtree or an incoming event.
 *
 * <p>Equality is length- and element-wise. {@link #append(Symbol)} returns a new path; the receiver and
 * every path derived from it before stay unchanged.
 */
public final class EventPath {

    private static final EventPath EMPTY = new EventPath(List.of());

    private final List<Symbol> symbols;

    private EventPath(List<Symbol> symbols) {
        this.symbols = symbols;
    }

    public static EventPath empty() {
        return EMPTY;
    }

    /**
     * Builds a path from literal segments.
     *
     * @throws IllegalArgumentException if any segment is empty
     */
    public static EventPath of(String... segments) {
        Objects.requireNonNull(segments, "segments");
        return ofSegments(List.of(segments));
    }

    public static EventPath ofSegments(List<String> segments) {
        Objects.requireNonNull(segments, "segments");
        List<Symbol> symbols = new ArrayList<>(segments.size());
        for (String segment : segments) {
            symbols.add(Symbol.literal(segment));
        }
        return new EventPath(Collections.unmodifiableList(symbols));
    }

    public EventPath append(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        List<Symbol> next = new ArrayList<>(symbols.size() + 1);
        next.addAll(symbols);
        next.add(symbol);
        return new EventPath(Collections.unmodifiableList(next));
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    public Optional<Symbol> first() {
        return symbols.isEmpty() ? Optional.empty() : Optional.of(symbols.get(0));
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    /**
     * The segments as plain strings, in wire order.
     */
    public List<String> segments() {
        List<String> out = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            out.add(symbol.value());
        }
        return out;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof EventPath)) return false;
        return symbols.equals(((EventPath) other).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
