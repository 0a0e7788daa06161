package org.javai.storage;

/**
 * A supplier that may throw a checked exception.
 * Wraps a single storage request so it can be translated and retried.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
