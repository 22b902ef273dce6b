package org.javai.result.transaction;

import org.javai.result.ErrorDetail;

/**
 * Reports how transactions run by {@link Transaction} were closed.
 * Implementations might emit metrics or structured logs. Every method defaults to a no-op.
 */
public interface TransactionReporter {

    /**
     * Reports that the bounded operation succeeded and the commit succeeded.
     *
     * @param transaction the transaction's name
     */
    default void reportCommitted(String transaction) {
    }

    /**
     * Reports that the bounded operation failed and the rollback succeeded.
     *
     * @param transaction the transaction's name
     * @param cause the bounded operation's failure
     */
    default void reportRolledBack(String transaction, ErrorDetail cause) {
    }

    /**
     * Reports that a commit or rollback function returned a failure.
     *
     * @param transaction the transaction's name
     * @param phase the step that failed
     * @param error the failure it returned
     */
    default void reportCompletionFailed(String transaction, TransactionPhase phase, ErrorDetail error) {
    }

    /**
     * Reports that an exception was thrown and the recovery rollback succeeded.
     *
     * @param transaction the transaction's name
     * @param cause the exception that triggered the recovery
     * @param failure the failure returned to the caller
     */
    default void reportRecovered(String transaction, Throwable cause, ErrorDetail failure) {
    }

    /**
     * Reports that the recovery rollback itself threw.
     *
     * @param transaction the transaction's name
     * @param phase the step that was under way when the first exception was thrown
     * @param cause the exception that triggered the recovery
     * @param recoveryCause the exception thrown by the recovery rollback
     */
    default void reportRecoveryFailed(String transaction, TransactionPhase phase, Throwable cause, Throwable recoveryCause) {
    }

    /**
     * A reporter that does nothing.
     */
    static TransactionReporter noOp() {
        return new TransactionReporter() {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static TransactionReporter composite(TransactionReporter... reporters) {
        return CompositeTransactionReporter.of(reporters);
    }
}
