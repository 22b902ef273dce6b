package org.javai.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A failure-biased view of a {@link Result}.
 *
 * <p>The operations mirror those of {@link Result} but act on the failure value and pass a
 * success through unchanged. A success passed through an operation that changes the failure
 * type loses its attached {@link FailureProducer}.
 *
 * <pre>{@code
 * Result<Order, ErrorDetail> annotated = result.projection()
 *     .map(detail -> detail.add("info", "order " + orderId));
 * }</pre>
 *
 * @param <S> The type of the success value
 * @param <F> The type of the failure value
 */
public final class FailureProjection<S, F> {

    private final Result<S, F> result;

    public FailureProjection(Result<S, F> result) {
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    /**
     * Returns the projected result.
     */
    public Result<S, F> result() {
        return result;
    }

    public void foreach(Consumer<? super F> effect) {
        if (result instanceof Result.Failure<S, F> failure) {
            Objects.requireNonNull(effect);
            effect.accept(failure.error());
        }
    }

    public F getOrElse(Supplier<? extends F> supplier) {
        if (result instanceof Result.Failure<S, F> failure) {
            return failure.error();
        }
        Objects.requireNonNull(supplier);
        return supplier.get();
    }

    public Result<S, F> orElse(Supplier<? extends Result<S, F>> supplier) {
        if (result.isFailure()) {
            return result;
        }
        Objects.requireNonNull(supplier);
        return supplier.get();
    }

    public boolean contains(F element) {
        return result instanceof Result.Failure<S, F> failure && Objects.equals(failure.error(), element);
    }

    public boolean forall(Predicate<? super F> predicate) {
        if (result instanceof Result.Failure<S, F> failure) {
            Objects.requireNonNull(predicate);
            return predicate.test(failure.error());
        }
        return true;
    }

    public boolean exists(Predicate<? super F> predicate) {
        if (result instanceof Result.Failure<S, F> failure) {
            Objects.requireNonNull(predicate);
            return predicate.test(failure.error());
        }
        return false;
    }

    /**
     * Feeds a failure value to {@code mapper} and returns its result. A success passes
     * through with its value.
     */
    public <F1> Result<S, F1> flatMap(Function<? super F, ? extends Result<S, F1>> mapper) {
        Objects.requireNonNull(mapper);
        return result.<Result<S, F1>>fold(Result.Success::new, mapper);
    }

    /**
     * Transforms a failure value. A success passes through with its value.
     */
    public <F1> Result<S, F1> map(Function<? super F, ? extends F1> mapper) {
        Objects.requireNonNull(mapper);
        return result.<Result<S, F1>>fold(Result.Success::new, error -> new Result.Failure<>(mapper.apply(error)));
    }

    /**
     * Like {@link #map}, but an exception thrown by {@code mapper} becomes a failure built by
     * {@code producer}, which is typed for the new failure side.
     */
    public <F1> Result<S, F1> safeMap(Function<? super F, ? extends F1> mapper, FailureProducer<F1> producer) {
        Objects.requireNonNull(mapper);
        return SafeCall.call(() -> map(mapper), producer);
    }

    /**
     * Like {@link #flatMap}, but an exception thrown by {@code mapper} becomes a failure built
     * by {@code producer}, which is typed for the new failure side.
     */
    public <F1> Result<S, F1> safeFlatMap(Function<? super F, ? extends Result<S, F1>> mapper, FailureProducer<F1> producer) {
        Objects.requireNonNull(mapper);
        return SafeCall.call(() -> flatMap(mapper), producer);
    }

    public Optional<F> toOptional() {
        if (result instanceof Result.Failure<S, F> failure) {
            return Optional.of(failure.error());
        }
        return Optional.empty();
    }

    /**
     * Converts to a {@link Try} holding the failure value. A success becomes a
     * {@link Try.Failure} holding a {@link ResultFailedException} whose message is the
     * success value's string form.
     */
    public Try<F> toTry() {
        if (result instanceof Result.Success<S, F> success) {
            return Try.failure(new ResultFailedException(success.value()));
        }
        return Try.success(((Result.Failure<S, F>) result).error());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof FailureProjection<?, ?> that && result.equals(that.result);
    }

    @Override
    public int hashCode() {
        return result.hashCode();
    }

    @Override
    public String toString() {
        return "FailureProjection[" + result + "]";
    }
}
