package io.objection.core;

/**
 * Raised while reading dynamic segments off an incoming path with {@link EventPathCursor}.
 *
 * <p>Handlers usually treat either case as "no such route".
 */
public abstract class EventPathException extends ObjectionException {

    protected EventPathException(String message) {
        super(message);
    }

    protected EventPathException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The path has fewer segments than the handler tried to read.
     */
    public static final class NoSymbolsLeft extends EventPathException {
        public NoSymbolsLeft(EventPath path) {
            super("tried to read the next symbol of " + path + ", but there are none left;"
                    + " this could be a renderer error, but it could also be caused by a missing Ui#scope call");
        }
    }

    /**
     * The next segment exists but does not decode as the requested type.
     */
    public static final class InvalidSymbol extends EventPathException {
        public InvalidSymbol(SymbolCodecException cause) {
            super("failed to parse the symbol from a string; " + cause.getMessage(), cause);
        }
    }
}
