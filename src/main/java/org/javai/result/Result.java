package org.javai.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Represents the result of an operation that may fail.
 * Either {@link Success} holding a value, or {@link Failure} holding a failure value.
 *
 * <p>Results are success biased: {@link #map}, {@link #flatMap} and the other combinators
 * operate on the success value and pass a failure through unchanged. Use
 * {@link #projection()} to operate on the failure side instead.
 *
 * <p>Every combinator comes in two modes:
 * <ul>
 *   <li><b>unsafe</b> ({@code fold}, {@code map}, {@code flatMap}, ...): exceptions thrown by
 *       the supplied functions propagate to the caller unchanged.</li>
 *   <li><b>safe</b> ({@code safeFold}, {@code safeMap}, {@code safeFlatMap}, ...): exceptions
 *       are caught and turned into a {@link Failure} by a {@link FailureProducer}. The
 *       producer is either passed to the call or attached to the {@link Success}.</li>
 * </ul>
 *
 * <p>A producer attached to a success is carried to the successes derived from it, so a
 * chain of safe calls only needs it once. {@link #swap()} changes the failure type and
 * therefore drops it.
 *
 * <pre>{@code
 * Result<Integer, ErrorDetail> port = StringResult.success(config)
 *     .safeMap(c -> c.get("port"))
 *     .safeMap(Integer::parseInt);
 * }</pre>
 *
 * @param <S> The type of the success value
 * @param <F> The type of the failure value
 */
public sealed interface Result<S, F> permits Result.Success, Result.Failure {

    /**
     * A successful result.
     *
     * <p>Equality, hash code and string form depend on the value only; the attached
     * producer is not part of a success's identity.
     *
     * @param value the success value, may be null
     * @param producer the failure producer used by the safe combinators, may be null
     */
    record Success<S, F>(S value, FailureProducer<F> producer) implements Result<S, F> {

        /**
         * Creates a success with no attached producer.
         *
         * @param value the success value
         */
        public Success(S value) {
            this(value, null);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public Optional<FailureProducer<F>> failureProducer() {
            return Optional.ofNullable(producer);
        }

        @Override
        public <C> C fold(Function<? super S, ? extends C> successFn, Function<? super F, ? extends C> failureFn) {
            Objects.requireNonNull(successFn);
            return successFn.apply(value);
        }

        @Override
        public Result<F, S> swap() {
            return new Failure<>(value);
        }

        @Override
        public Result<F, S> swap(FailureProducer<S> producer) {
            return new Failure<>(value);
        }

        @Override
        public void foreach(Consumer<? super S> effect) {
            Objects.requireNonNull(effect);
            effect.accept(value);
        }

        @Override
        public S getOrElse(Supplier<? extends S> supplier) {
            return value;
        }

        @Override
        public Result<S, F> orElse(Supplier<? extends Result<S, F>> supplier) {
            return this;
        }

        @Override
        public boolean contains(S element) {
            return Objects.equals(value, element);
        }

        @Override
        public boolean forall(Predicate<? super S> predicate) {
            Objects.requireNonNull(predicate);
            return predicate.test(value);
        }

        @Override
        public boolean exists(Predicate<? super S> predicate) {
            Objects.requireNonNull(predicate);
            return predicate.test(value);
        }

        @Override
        public <S1> Result<S1, F> flatMap(Function<? super S, ? extends Result<S1, F>> mapper) {
            Objects.requireNonNull(mapper);
            return Objects.requireNonNull(mapper.apply(value), "mapper returned null");
        }

        @Override
        public <S1> Result<S1, F> map(Function<? super S, ? extends S1> mapper) {
            Objects.requireNonNull(mapper);
            return new Success<>(mapper.apply(value), producer);
        }

        @Override
        public Optional<S> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public Try<S> toTry() {
            return Try.success(value);
        }

        @Override
        public S getOrThrow() {
            return value;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            return other instanceof Success<?, ?> that && Objects.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Success[value=" + value + "]";
        }
    }

    /**
     * A failed result.
     *
     * @param error the failure value
     */
    record Failure<S, F>(F error) implements Result<S, F> {

        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public Optional<FailureProducer<F>> failureProducer() {
            return Optional.empty();
        }

        @Override
        public <C> C fold(Function<? super S, ? extends C> successFn, Function<? super F, ? extends C> failureFn) {
            Objects.requireNonNull(failureFn);
            return failureFn.apply(error);
        }

        @Override
        public Result<F, S> swap() {
            return new Success<>(error);
        }

        @Override
        public Result<F, S> swap(FailureProducer<S> producer) {
            Objects.requireNonNull(producer, "producer must not be null");
            return new Success<>(error, producer);
        }

        @Override
        public void foreach(Consumer<? super S> effect) {
            Objects.requireNonNull(effect);
        }

        @Override
        public S getOrElse(Supplier<? extends S> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public Result<S, F> orElse(Supplier<? extends Result<S, F>> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public boolean contains(S element) {
            return false;
        }

        @Override
        public boolean forall(Predicate<? super S> predicate) {
            Objects.requireNonNull(predicate);
            return true;
        }

        @Override
        public boolean exists(Predicate<? super S> predicate) {
            Objects.requireNonNull(predicate);
            return false;
        }

        @Override
        public <S1> Result<S1, F> flatMap(Function<? super S, ? extends Result<S1, F>> mapper) {
            Objects.requireNonNull(mapper);
            return new Failure<>(error);
        }

        @Override
        public <S1> Result<S1, F> map(Function<? super S, ? extends S1> mapper) {
            Objects.requireNonNull(mapper);
            return new Failure<>(error);
        }

        @Override
        public Optional<S> toOptional() {
            return Optional.empty();
        }

        @Override
        public Try<S> toTry() {
            return Try.failure(new ResultFailedException(error));
        }

        @Override
        public S getOrThrow() {
            throw new ResultFailedException(error);
        }
    }

    // Query methods
    boolean isSuccess();
    boolean isFailure();

    /**
     * Returns the failure producer attached to this result. A failure never has one.
     */
    Optional<FailureProducer<F>> failureProducer();

    /**
     * Applies {@code successFn} to a success value or {@code failureFn} to a failure value
     * and returns what it returns. Exceptions thrown by either function propagate.
     */
    <C> C fold(Function<? super S, ? extends C> successFn, Function<? super F, ? extends C> failureFn);

    /**
     * Turns a success into a failure holding the same value and a failure into a success
     * holding the same value. The new success carries no failure producer.
     */
    Result<F, S> swap();

    /**
     * Like {@link #swap()}, but a success created from a failure carries {@code producer},
     * which is typed for the swapped failure side.
     */
    Result<F, S> swap(FailureProducer<S> producer);

    // Success-side queries
    void foreach(Consumer<? super S> effect);
    S getOrElse(Supplier<? extends S> supplier);
    Result<S, F> orElse(Supplier<? extends Result<S, F>> supplier);
    boolean contains(S element);
    boolean forall(Predicate<? super S> predicate);
    boolean exists(Predicate<? super S> predicate);

    // Transformations
    <S1> Result<S1, F> flatMap(Function<? super S, ? extends Result<S1, F>> mapper);
    <S1> Result<S1, F> map(Function<? super S, ? extends S1> mapper);

    // Conversions
    Optional<S> toOptional();

    /**
     * Converts to a {@link Try}. A failure becomes a {@link Try.Failure} holding a
     * {@link ResultFailedException} whose message is the failure value's string form.
     */
    Try<S> toTry();

    /**
     * Returns the success value.
     *
     * @throws ResultFailedException if this is a failure
     */
    S getOrThrow();

    default FailureProjection<S, F> projection() {
        return new FailureProjection<>(this);
    }

    // Safe variants

    /**
     * Folds inside the exception boundary of this result's attached producer.
     *
     * <p>The folded value is returned as a success carrying the producer, and an exception
     * thrown while folding is returned as a failure built by the producer. When there is no
     * attached producer the fold is returned as a plain success and exceptions propagate.
     */
    default <C> Result<C, F> safeFold(Function<? super S, ? extends C> successFn, Function<? super F, ? extends C> failureFn) {
        return safeFold(successFn, failureFn, failureProducer().orElse(null));
    }

    /**
     * Folds inside the exception boundary of {@code producer}, or of the attached producer
     * when {@code producer} is null.
     */
    default <C> Result<C, F> safeFold(
            Function<? super S, ? extends C> successFn,
            Function<? super F, ? extends C> failureFn,
            FailureProducer<F> producer
    ) {
        FailureProducer<F> active = activeProducer(producer);
        if (active == null) {
            return new Success<>(fold(successFn, failureFn));
        }
        return SafeCall.call(() -> new Success<>(fold(successFn, failureFn), active), active);
    }

    default <S1> Result<S1, F> safeMap(Function<? super S, ? extends S1> mapper) {
        return safeMap(mapper, null);
    }

    /**
     * Maps the success value, converting an exception thrown by {@code mapper} into a
     * failure. Without any producer this is {@link #map}.
     */
    default <S1> Result<S1, F> safeMap(Function<? super S, ? extends S1> mapper, FailureProducer<F> producer) {
        Objects.requireNonNull(mapper);
        FailureProducer<F> active = activeProducer(producer);
        if (active == null) {
            return map(mapper);
        }
        return SafeCall.call(
                () -> this.<Result<S1, F>>fold(value -> new Success<>(mapper.apply(value), active), Failure::new),
                active);
    }

    default <S1> Result<S1, F> safeFlatMap(Function<? super S, ? extends Result<S1, F>> mapper) {
        return safeFlatMap(mapper, null);
    }

    /**
     * Flat-maps the success value, converting an exception thrown by {@code mapper} into a
     * failure. A success returned by {@code mapper} without a producer gets the active one
     * attached. Without any producer this is {@link #flatMap}.
     */
    default <S1> Result<S1, F> safeFlatMap(Function<? super S, ? extends Result<S1, F>> mapper, FailureProducer<F> producer) {
        Objects.requireNonNull(mapper);
        FailureProducer<F> active = activeProducer(producer);
        if (active == null) {
            return flatMap(mapper);
        }
        return SafeCall.call(
                () -> this.<Result<S1, F>>fold(
                        value -> withProducer(Objects.requireNonNull(mapper.apply(value), "mapper returned null"), active),
                        Failure::new),
                active);
    }

    default Result<S, F> safeForeach(Consumer<? super S> effect) {
        return safeForeach(effect, null);
    }

    /**
     * Runs {@code effect} on a success value. Returns this result when the effect completes
     * and a failure from the producer when it throws.
     */
    default Result<S, F> safeForeach(Consumer<? super S> effect, FailureProducer<F> producer) {
        FailureProducer<F> active = activeProducer(producer);
        if (active == null) {
            foreach(effect);
            return this;
        }
        return SafeCall.call(() -> {
            foreach(effect);
            return withProducer(this, active);
        }, active);
    }

    default Result<Boolean, F> safeForall(Predicate<? super S> predicate) {
        return safeForall(predicate, null);
    }

    /**
     * Evaluates {@link #forall} inside the exception boundary and returns its answer as a
     * success, or the failure built from a thrown exception.
     */
    default Result<Boolean, F> safeForall(Predicate<? super S> predicate, FailureProducer<F> producer) {
        FailureProducer<F> active = activeProducer(producer);
        if (active == null) {
            return new Success<>(forall(predicate));
        }
        return SafeCall.call(() -> new Success<>(forall(predicate), active), active);
    }

    default Result<Boolean, F> safeExists(Predicate<? super S> predicate) {
        return safeExists(predicate, null);
    }

    /**
     * Evaluates {@link #exists} inside the exception boundary and returns its answer as a
     * success, or the failure built from a thrown exception.
     */
    default Result<Boolean, F> safeExists(Predicate<? super S> predicate, FailureProducer<F> producer) {
        FailureProducer<F> active = activeProducer(producer);
        if (active == null) {
            return new Success<>(exists(predicate));
        }
        return SafeCall.call(() -> new Success<>(exists(predicate), active), active);
    }

    private FailureProducer<F> activeProducer(FailureProducer<F> explicit) {
        return explicit != null ? explicit : failureProducer().orElse(null);
    }

    private static <S, F> Result<S, F> withProducer(Result<S, F> result, FailureProducer<F> producer) {
        if (result instanceof Success<S, F> success && success.producer() == null) {
            return new Success<>(success.value(), producer);
        }
        return result;
    }

    // Static factories
    static <S, F> Result<S, F> success(S value) {
        return new Success<>(value);
    }

    static <S, F> Result<S, F> success(S value, FailureProducer<F> producer) {
        return new Success<>(value, producer);
    }

    static <S, F> Result<S, F> failure(F error) {
        return new Failure<>(error);
    }

    /**
     * Removes one level of nesting. A success holding a result yields that inner result
     * unchanged; a failure passes through with its error.
     */
    static <S, F> Result<S, F> flatten(Result<? extends Result<S, F>, F> nested) {
        Objects.requireNonNull(nested, "nested must not be null");
        return nested.<Result<S, F>>fold(inner -> Objects.requireNonNull(inner, "success must hold a result"), Failure::new);
    }

    /**
     * Runs work that may throw a checked exception.
     *
     * @param work the work to run
     * @param producer converts a thrown exception into the failure value
     * @return a success holding the value and carrying {@code producer}, or a failure
     */
    static <S, F> Result<S, F> attempt(ThrowingSupplier<? extends S, ? extends Exception> work, FailureProducer<F> producer) {
        Objects.requireNonNull(work, "work must not be null");
        return SafeCall.call(() -> new Success<>(work.get(), producer), producer);
    }

    /**
     * Runs work that returns a result, converting an exception it throws into a failure.
     */
    static <S, F> Result<S, F> attemptResult(Supplier<? extends Result<S, F>> work, FailureProducer<F> producer) {
        Objects.requireNonNull(work, "work must not be null");
        return SafeCall.call(() -> Objects.requireNonNull(work.get(), "work returned null"), producer);
    }
}
