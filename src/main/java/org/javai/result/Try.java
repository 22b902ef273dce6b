package org.javai.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A value or the exception that prevented it from being computed.
 *
 * <p>This is the standard two-way container that {@link Result#toTry()} and
 * {@link FailureProjection#toTry()} convert into. Unlike {@link Result}, the failure side
 * is always a {@link Throwable}.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Try<T> permits Try.Success, Try.Failure {

    /**
     * A successful computation.
     *
     * @param value the computed value, may be null
     */
    record Success<T>(T value) implements Try<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }
    }

    /**
     * A failed computation.
     *
     * @param error the exception describing the failure
     */
    record Failure<T>(Throwable error) implements Try<T> {

        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T get() {
            if (error instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (error instanceof Error fatal) {
                throw fatal;
            }
            throw new IllegalStateException(error.getMessage(), error);
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the value, or rethrows the failure's exception.
     * Checked exceptions are wrapped in an {@link IllegalStateException}.
     */
    T get();

    T getOrElseGet(Supplier<? extends T> supplier);

    Optional<T> toOptional();

    static <T> Try<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Try<T> failure(Throwable error) {
        return new Failure<>(error);
    }
}
