package io.objection.core;

/**
 * Work performed with a scoped {@link Client}, see {@link SessionRoot#withClient(ClientFunction)}.
 *
 * @param <R> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface ClientFunction<R, E extends Exception> {
    R apply(Client client) throws E;
}
