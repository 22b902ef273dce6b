package org.javai.result;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The exception boundary used by the safe combinators.
 *
 * <p>Runs work that produces a {@link Result}; any {@link Exception} thrown while doing so
 * is handed to the {@link FailureProducer} and returned as a {@link Result.Failure}.
 * Errors are not caught. Work returning {@code null} is treated as having thrown a
 * {@link NullPointerException}.
 */
final class SafeCall {

    private static final Logger logger = LoggerFactory.getLogger(SafeCall.class);

    private SafeCall() {
    }

    static <S, F> Result<S, F> call(
            ThrowingSupplier<? extends Result<S, F>, ? extends Exception> work,
            FailureProducer<F> producer
    ) {
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(producer, "producer must not be null");

        try {
            return Objects.requireNonNull(work.get(), "safe work returned null instead of a result");
        } catch (Exception e) {
            logger.debug("Converted {} into a failure: {}", e.getClass().getName(), e.getMessage(), e);
            F failure = producer.produce(e);
            if (failure == null) {
                throw new IllegalStateException(
                        "FailureProducer " + producer.getClass().getName() + " returned null for " + e.getClass().getName(), e);
            }
            return new Result.Failure<>(failure);
        }
    }
}
