package org.javai.result;

/**
 * Converts a caught exception into a failure value.
 *
 * <p>A producer attached to a {@link Result.Success} keeps the results derived from it
 * in safe mode: the safe combinators use it to turn an exception thrown by a caller
 * supplied function into a {@link Result.Failure} instead of letting it escape.
 *
 * @param <F> The failure type produced
 */
@FunctionalInterface
public interface FailureProducer<F> {

    /**
     * Produces the failure value for an exception.
     *
     * @param throwable the exception that was caught, may be null
     * @return the failure value, never null; a safe combinator whose producer returns null
     *         throws {@link IllegalStateException}
     */
    F produce(Throwable throwable);
}
