package org.javai.result;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Helpers for results whose failure value is an {@link ErrorDetail}.
 *
 * <p>Successes created here carry {@link #PRODUCER}, so the safe combinators on them turn an
 * exception into a failure holding the exception's message as an {@code "error"} entry.
 *
 * <pre>{@code
 * Result<Integer, ErrorDetail> result = StringResult.success("42").safeMap(Integer::parseInt);
 *
 * Result<Integer, ErrorDetail> failed = StringResult.add(
 *     StringResult.failure("lookup failed"), "info", "key=" + key);
 * }</pre>
 */
public final class StringResult {

    /**
     * Builds an {@link ErrorDetail} from an exception's message.
     */
    public static final FailureProducer<ErrorDetail> PRODUCER = ErrorDetail::fromThrowable;

    private StringResult() {
    }

    public static <S> Result<S, ErrorDetail> success(S value) {
        return new Result.Success<>(value, PRODUCER);
    }

    /**
     * Creates a failure with a single {@code "error"} entry holding {@code message}.
     */
    public static <S> Result<S, ErrorDetail> failure(String message) {
        return new Result.Failure<>(ErrorDetail.of(message));
    }

    public static <S> Result<S, ErrorDetail> failure(ErrorDetail detail) {
        return new Result.Failure<>(detail);
    }

    /**
     * Appends an entry to a failure's detail. The given result is not modified; a success
     * is returned unchanged.
     *
     * @param result the result to annotate
     * @param category the entry's category
     * @param message the entry's message
     * @return a new failure with the entry appended, or {@code result} if it is a success
     */
    public static <S> Result<S, ErrorDetail> add(Result<S, ErrorDetail> result, String category, String message) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.isSuccess()) {
            return result;
        }
        return result.projection().map(detail -> detail.add(category, message));
    }

    /**
     * Returns whether a projected failure's detail holds {@code entry}.
     */
    public static <S> boolean containsDeep(FailureProjection<S, ErrorDetail> projection, ErrorDetail.Entry entry) {
        return projection.exists(detail -> detail.contains(entry));
    }

    public static <S, S1> Result<S1, ErrorDetail> safeMap(Result<S, ErrorDetail> result, Function<? super S, ? extends S1> mapper) {
        return result.safeMap(mapper, PRODUCER);
    }

    public static <S, S1> Result<S1, ErrorDetail> safeFlatMap(
            Result<S, ErrorDetail> result,
            Function<? super S, ? extends Result<S1, ErrorDetail>> mapper
    ) {
        return result.safeFlatMap(mapper, PRODUCER);
    }

    public static <S, C> Result<C, ErrorDetail> safeFold(
            Result<S, ErrorDetail> result,
            Function<? super S, ? extends C> successFn,
            Function<? super ErrorDetail, ? extends C> failureFn
    ) {
        return result.safeFold(successFn, failureFn, PRODUCER);
    }

    public static <S> Result<S, ErrorDetail> safeForeach(Result<S, ErrorDetail> result, Consumer<? super S> effect) {
        return result.safeForeach(effect, PRODUCER);
    }

    public static <S> Result<Boolean, ErrorDetail> safeForall(Result<S, ErrorDetail> result, Predicate<? super S> predicate) {
        return result.safeForall(predicate, PRODUCER);
    }

    public static <S> Result<Boolean, ErrorDetail> safeExists(Result<S, ErrorDetail> result, Predicate<? super S> predicate) {
        return result.safeExists(predicate, PRODUCER);
    }

    /**
     * Runs work that may throw a checked exception, reporting an exception's message as
     * the failure.
     */
    public static <S> Result<S, ErrorDetail> attempt(ThrowingSupplier<? extends S, ? extends Exception> work) {
        return Result.attempt(work, PRODUCER);
    }
}
