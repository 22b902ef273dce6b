package org.javai.result.transaction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import org.javai.result.ErrorDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TransactionReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * TransactionReporter reporter = CompositeTransactionReporter.of(
 *     new Log4jTransactionReporter(),
 *     new MetricsTransactionReporter("myapp")
 * );
 *
 * // Or using the builder for more control:
 * TransactionReporter reporter = CompositeTransactionReporter.builder()
 *     .add(new Log4jTransactionReporter())
 *     .addIf(metricsEnabled, new MetricsTransactionReporter())
 *     .build();
 * }</pre>
 */
public final class CompositeTransactionReporter implements TransactionReporter {

	private static final Logger logger = LoggerFactory.getLogger(CompositeTransactionReporter.class);

	private final List<TransactionReporter> reporters;

	private CompositeTransactionReporter(List<TransactionReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeTransactionReporter of(TransactionReporter... reporters) {
		return new CompositeTransactionReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeTransactionReporter of(Collection<? extends TransactionReporter> reporters) {
		return new CompositeTransactionReporter(new ArrayList<>(reporters));
	}

	/**
	 * Creates a builder for constructing a composite reporter.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportCommitted(String transaction) {
		fanOut("reportCommitted", reporter -> reporter.reportCommitted(transaction));
	}

	@Override
	public void reportRolledBack(String transaction, ErrorDetail cause) {
		fanOut("reportRolledBack", reporter -> reporter.reportRolledBack(transaction, cause));
	}

	@Override
	public void reportCompletionFailed(String transaction, TransactionPhase phase, ErrorDetail error) {
		fanOut("reportCompletionFailed", reporter -> reporter.reportCompletionFailed(transaction, phase, error));
	}

	@Override
	public void reportRecovered(String transaction, Throwable cause, ErrorDetail failure) {
		fanOut("reportRecovered", reporter -> reporter.reportRecovered(transaction, cause, failure));
	}

	@Override
	public void reportRecoveryFailed(String transaction, TransactionPhase phase, Throwable cause, Throwable recoveryCause) {
		fanOut("reportRecoveryFailed", reporter -> reporter.reportRecoveryFailed(transaction, phase, cause, recoveryCause));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<TransactionReporter> call) {
		for (TransactionReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				logger.warn("TransactionReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage());
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeTransactionReporter}.
	 */
	public static final class Builder {
		private final List<TransactionReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null reporters are ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(TransactionReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends TransactionReporter> reporters) {
			for (TransactionReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, TransactionReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeTransactionReporter build() {
			return new CompositeTransactionReporter(reporters);
		}
	}
}
