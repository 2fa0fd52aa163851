package io.objection.core;

import java.util.Objects;

/**
 * One path segment: either a static literal or a {@link SymbolCodec}-encoded dynamic value.
 *
 * <p>Symbols are never empty.
 */
public final class Symbol {

    private final String value;

    private Symbol(String value) {
        Objects.requireNonNull(value, "symbol");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
        this.value = value;
    }

    /**
     * A static segment used verbatim, such as {@code "main"} or {@code "sidebar"}.
     */
    public static Symbol literal(String value) {
        return new Symbol(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Symbol)) return false;
        return value.equals(((Symbol) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
