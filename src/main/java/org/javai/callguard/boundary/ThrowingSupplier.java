package org.javai.callguard.boundary;

/**
 * A supplier that may throw a checked exception.
 * Lets blocking client calls be handed to {@link org.javai.callguard.Operation} adapters as lambdas.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
