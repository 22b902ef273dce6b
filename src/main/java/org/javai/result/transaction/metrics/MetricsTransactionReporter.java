package org.javai.result.transaction.metrics;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.javai.result.ErrorDetail;
import org.javai.result.transaction.TransactionPhase;
import org.javai.result.transaction.TransactionReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports transaction events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object logged at INFO, suitable for metrics aggregation.
 * The tracking key is the transaction name, prefixed by a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"rolled_back","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.orders.save","errors":[{"category":"error","message":"out of stock"}]}
 * }</pre>
 */
public class MetricsTransactionReporter implements TransactionReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.result.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsTransactionReporter with no namespace and the default logger.
	 */
	public MetricsTransactionReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsTransactionReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsTransactionReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsTransactionReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsTransactionReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportCommitted(String transaction) {
		emit(startEvent("committed", transaction));
	}

	@Override
	public void reportRolledBack(String transaction, ErrorDetail cause) {
		StringBuilder sb = startEvent("rolled_back", transaction);
		appendErrors(sb, cause);
		emit(sb);
	}

	@Override
	public void reportCompletionFailed(String transaction, TransactionPhase phase, ErrorDetail error) {
		StringBuilder sb = startEvent("completion_failed", transaction);
		appendField(sb, "phase", phase.label());
		appendErrors(sb, error);
		emit(sb);
	}

	@Override
	public void reportRecovered(String transaction, Throwable cause, ErrorDetail failure) {
		StringBuilder sb = startEvent("recovered", transaction);
		appendField(sb, "causeType", cause.getClass().getName());
		appendErrors(sb, failure);
		emit(sb);
	}

	@Override
	public void reportRecoveryFailed(String transaction, TransactionPhase phase, Throwable cause, Throwable recoveryCause) {
		StringBuilder sb = startEvent("recovery_failed", transaction);
		appendField(sb, "phase", phase.label());
		appendField(sb, "causeType", cause.getClass().getName());
		appendField(sb, "recoveryCauseType", recoveryCause.getClass().getName());
		appendField(sb, "message", recoveryCause.getMessage());
		emit(sb);
	}

	String buildTrackingKey(String transaction) {
		if (namespace == null) {
			return transaction;
		}
		return namespace + "." + transaction;
	}

	private StringBuilder startEvent(String eventType, String transaction) {
		StringBuilder sb = new StringBuilder();
		sb.append("{\"eventType\":\"").append(escapeJson(eventType)).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()));
		appendField(sb, "trackingKey", buildTrackingKey(transaction));
		return sb;
	}

	private void emit(StringBuilder sb) {
		try {
			logger.info(sb.append("}").toString());
		} catch (Exception e) {
			// Reporting should not break the transaction
		}
	}

	private static void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static void appendErrors(StringBuilder sb, ErrorDetail detail) {
		sb.append(",\"errors\":[");
		List<ErrorDetail.Entry> entries = detail == null ? List.of() : detail.entries();
		for (int i = 0; i < entries.size(); i++) {
			if (i > 0) {
				sb.append(",");
			}
			ErrorDetail.Entry entry = entries.get(i);
			sb.append("{\"category\":\"").append(escapeJson(entry.category()))
			  .append("\",\"message\":\"").append(escapeJson(entry.message())).append("\"}");
		}
		sb.append("]");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}
}
