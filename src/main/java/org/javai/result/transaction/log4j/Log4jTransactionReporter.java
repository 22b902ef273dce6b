package org.javai.result.transaction.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.result.ErrorDetail;
import org.javai.result.transaction.TransactionPhase;
import org.javai.result.transaction.TransactionReporter;

/**
 * Reports transaction events using Log4j2 logging.
 *
 * <p>Events are logged at levels that reflect how much attention they need:
 * <ul>
 *   <li>commit → DEBUG</li>
 *   <li>rollback of a failed operation → INFO</li>
 *   <li>commit or rollback returned a failure, recovery rollback after an exception → WARN</li>
 *   <li>recovery rollback threw → ERROR</li>
 * </ul>
 *
 * <p>Every event carries the {@code TRANSACTION} marker; rollbacks and recoveries carry a
 * child marker so they can be routed separately.
 */
public class Log4jTransactionReporter implements TransactionReporter {

	static final Marker TRANSACTION_MARKER = MarkerManager.getMarker("TRANSACTION");
	static final Marker ROLLBACK_MARKER = MarkerManager.getMarker("TRANSACTION_ROLLBACK").setParents(TRANSACTION_MARKER);
	static final Marker RECOVERY_MARKER = MarkerManager.getMarker("TRANSACTION_RECOVERY").setParents(TRANSACTION_MARKER);

	private final Logger logger;

	/**
	 * Creates a Log4jTransactionReporter using the default logger name.
	 */
	public Log4jTransactionReporter() {
		this(LogManager.getLogger("org.javai.result.Transaction"));
	}

	/**
	 * Creates a Log4jTransactionReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jTransactionReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jTransactionReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jTransactionReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportCommitted(String transaction) {
		logger.atDebug()
			.withMarker(TRANSACTION_MARKER)
			.log("Transaction [{}] committed", transaction);
	}

	@Override
	public void reportRolledBack(String transaction, ErrorDetail cause) {
		logger.atInfo()
			.withMarker(ROLLBACK_MARKER)
			.log("Transaction [{}] rolled back after failure: {}", transaction, cause);
	}

	@Override
	public void reportCompletionFailed(String transaction, TransactionPhase phase, ErrorDetail error) {
		Marker marker = phase == TransactionPhase.ROLLBACK ? ROLLBACK_MARKER : TRANSACTION_MARKER;
		logger.atWarn()
			.withMarker(marker)
			.log("Transaction [{}] {} failed: {}", transaction, phase.label(), error);
	}

	@Override
	public void reportRecovered(String transaction, Throwable cause, ErrorDetail failure) {
		logger.atWarn()
			.withMarker(RECOVERY_MARKER)
			.withThrowable(cause)
			.log("Transaction [{}] rolled back after exception. Failure: {}", transaction, failure);
	}

	@Override
	public void reportRecoveryFailed(String transaction, TransactionPhase phase, Throwable cause, Throwable recoveryCause) {
		logger.atError()
			.withMarker(RECOVERY_MARKER)
			.withThrowable(recoveryCause)
			.log("Transaction [{}] could not be rolled back after an exception during {}: {}",
				transaction,
				phase.label(),
				cause.getMessage());
	}
}
