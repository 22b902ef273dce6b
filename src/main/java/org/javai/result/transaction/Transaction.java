package org.javai.result.transaction;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.javai.result.ErrorDetail;
import org.javai.result.Result;
import org.javai.result.StringResult;

/**
 * Runs a bounded operation against a transaction handle and then commits or rolls back.
 *
 * <p>Given a successful result holding a handle:
 * <ol>
 *   <li>the bounded operation is run;</li>
 *   <li>if the handle is not transactional (the caller does not own its boundaries) the
 *       operation's result is returned as is;</li>
 *   <li>otherwise a successful result is committed and a failed one rolled back, and the
 *       operation's result is returned unless the commit or rollback itself fails;</li>
 *   <li>if anything throws, a rollback is attempted and a failure is returned whose first
 *       entry is the exception's message, followed by the operation's own failure entries.</li>
 * </ol>
 *
 * <p>A failed handle result is returned as is and nothing runs.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Result<Order, ErrorDetail> saved = Transaction.run(
 *     connections.begin(),
 *     Connection::ownsTransaction,
 *     () -> orders.save(order),
 *     Connection::commit,
 *     Connection::rollback
 * );
 *
 * // With reporting
 * Transaction transaction = Transaction.builder()
 *     .name("orders.save")
 *     .reporter(new Log4jTransactionReporter())
 *     .build();
 * }</pre>
 */
public final class Transaction {

    static final String NO_MESSAGE = "[no message]";

    private static final Transaction DEFAULT = builder().build();

    private final String name;
    private final TransactionReporter reporter;

    private Transaction(String name, TransactionReporter reporter) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Creates a builder for configuring a Transaction instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Transaction instance.
     */
    public static final class Builder {
        private String name = "transaction";
        private TransactionReporter reporter = TransactionReporter.noOp();

        private Builder() {}

        /**
         * Sets the name used when reporting (optional, defaults to "transaction").
         *
         * @param name the transaction's name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        /**
         * Sets the reporter (optional, defaults to no-op).
         *
         * @param reporter the reporter for commit and rollback events
         * @return this builder
         */
        public Builder reporter(TransactionReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Transaction build() {
            return new Transaction(name, reporter);
        }
    }

    /**
     * Runs a transaction without reporting.
     *
     * @see #execute(Result, Predicate, Supplier, Function, Function)
     */
    public static <S, S1> Result<S1, ErrorDetail> run(
            Result<S, ErrorDetail> handleResult,
            Predicate<? super S> isTransactional,
            Supplier<? extends Result<S1, ErrorDetail>> boundedOperation,
            Function<? super S, ? extends Result<Boolean, ErrorDetail>> commit,
            Function<? super S, ? extends Result<Boolean, ErrorDetail>> rollback
    ) {
        return DEFAULT.execute(handleResult, isTransactional, boundedOperation, commit, rollback);
    }

    /**
     * Runs the bounded operation and closes the transaction.
     *
     * @param handleResult the result holding the transaction handle
     * @param isTransactional whether this caller owns the handle's transaction boundaries
     * @param boundedOperation the work done inside the transaction
     * @param commit commits the handle's transaction
     * @param rollback rolls back the handle's transaction
     * @return the bounded operation's result, or a failure describing what went wrong
     */
    public <S, S1> Result<S1, ErrorDetail> execute(
            Result<S, ErrorDetail> handleResult,
            Predicate<? super S> isTransactional,
            Supplier<? extends Result<S1, ErrorDetail>> boundedOperation,
            Function<? super S, ? extends Result<Boolean, ErrorDetail>> commit,
            Function<? super S, ? extends Result<Boolean, ErrorDetail>> rollback
    ) {
        Objects.requireNonNull(handleResult, "handleResult must not be null");
        Objects.requireNonNull(isTransactional, "isTransactional must not be null");
        Objects.requireNonNull(boundedOperation, "boundedOperation must not be null");
        Objects.requireNonNull(commit, "commit must not be null");
        Objects.requireNonNull(rollback, "rollback must not be null");

        if (handleResult instanceof Result.Failure<S, ErrorDetail> failure) {
            return new Result.Failure<>(failure.error());
        }
        S handle = ((Result.Success<S, ErrorDetail>) handleResult).value();

        Result<S1, ErrorDetail> result = null;
        try {
            result = Objects.requireNonNull(boundedOperation.get(), "bounded operation returned null");
            if (!isTransactional.test(handle)) {
                return result;
            }
            return complete(handle, result, commit, rollback);
        } catch (Exception e) {
            return recover(handle, result, e, rollback);
        }
    }

    private <S, S1> Result<S1, ErrorDetail> complete(
            S handle,
            Result<S1, ErrorDetail> result,
            Function<? super S, ? extends Result<Boolean, ErrorDetail>> commit,
            Function<? super S, ? extends Result<Boolean, ErrorDetail>> rollback
    ) {
        TransactionPhase phase = phaseFor(result);
        Result<Boolean, ErrorDetail> closed = phase == TransactionPhase.COMMIT
                ? commit.apply(handle)
                : rollback.apply(handle);
        Objects.requireNonNull(closed, phase.label() + " returned null");

        if (closed instanceof Result.Failure<Boolean, ErrorDetail> failure) {
            reporter.reportCompletionFailed(name, phase, failure.error());
        } else if (phase == TransactionPhase.COMMIT) {
            reporter.reportCommitted(name);
        } else {
            reporter.reportRolledBack(name, result.projection().getOrElse(ErrorDetail::empty));
        }
        return closed.flatMap(ignored -> result);
    }

    private <S, S1> Result<S1, ErrorDetail> recover(
            S handle,
            Result<S1, ErrorDetail> result,
            Exception cause,
            Function<? super S, ? extends Result<Boolean, ErrorDetail>> rollback
    ) {
        TransactionPhase phase = phaseFor(result);
        try {
            Result<Boolean, ErrorDetail> rolledBack = Objects.requireNonNull(rollback.apply(handle), "rollback returned null");
            if (rolledBack instanceof Result.Failure<Boolean, ErrorDetail> failure) {
                reporter.reportCompletionFailed(name, TransactionPhase.ROLLBACK, failure.error());
                return new Result.Failure<>(failure.error());
            }
            ErrorDetail detail = ErrorDetail.of(messageOf(cause));
            if (result instanceof Result.Failure<S1, ErrorDetail> failed) {
                detail = detail.addAll(failed.error());
            }
            reporter.reportRecovered(name, cause, detail);
            return StringResult.failure(detail);
        } catch (Exception recoveryCause) {
            reporter.reportRecoveryFailed(name, phase, cause, recoveryCause);
            return StringResult.failure("Exception thrown when attempting to " + phase.label()
                    + " the transaction, and then again on the final rollback: " + messageOf(recoveryCause));
        }
    }

    // a missing result (the bounded operation threw) counts as the commit path
    private static TransactionPhase phaseFor(Result<?, ErrorDetail> result) {
        return result != null && result.isFailure() ? TransactionPhase.ROLLBACK : TransactionPhase.COMMIT;
    }

    private static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null ? NO_MESSAGE : message;
    }

    public String name() {
        return name;
    }
}
