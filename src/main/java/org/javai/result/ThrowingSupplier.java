package org.javai.result;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link Result#attempt(ThrowingSupplier, FailureProducer)} to wrap calls into APIs
 * that declare checked exceptions.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
