package org.cloudplane.ops;

import java.time.Duration;

/**
 * Receives retry lifecycle events for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Every method defaults to a no-op, so implementations override only what they need.
 */
public interface RetryReporter {

	/**
	 * Reports that a failed attempt will be retried.
	 *
	 * @param operation The operation name
	 * @param failure The failure that triggered the retry
	 * @param attemptNumber The attempt that failed (1-based)
	 * @param delay The wait before the next attempt
	 */
	default void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
	}

	/**
	 * Reports that every allowed attempt failed.
	 *
	 * @param operation The operation name
	 * @param failure The final failure
	 * @param totalAttempts The total number of attempts made
	 */
	default void reportRetryExhausted(String operation, Throwable failure, int totalAttempts) {
	}

	/**
	 * Reports that an attempt failed in a way retrying cannot fix.
	 *
	 * @param operation The operation name
	 * @param failure The failure, returned to the caller as is
	 * @param attemptNumber The attempt that failed (1-based)
	 */
	default void reportNonRetryable(String operation, Throwable failure, int attemptNumber) {
	}

	/**
	 * Reports that the loop was cancelled.
	 *
	 * @param operation The operation name
	 * @param lastFailure The most recent failure, or null if no attempt was made
	 * @param attemptsMade The number of attempts made before cancellation
	 */
	default void reportCancelled(String operation, Throwable lastFailure, int attemptsMade) {
	}

	/**
	 * A reporter that does nothing.
	 */
	static RetryReporter noOp() {
		return NoOpRetryReporter.INSTANCE;
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static RetryReporter composite(RetryReporter... reporters) {
		return CompositeRetryReporter.of(reporters);
	}
}
