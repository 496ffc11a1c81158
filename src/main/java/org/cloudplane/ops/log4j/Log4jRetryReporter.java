package org.cloudplane.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.cloudplane.api.ApiError;
import org.cloudplane.ops.RetryReporter;

import java.time.Duration;

/**
 * Reports retry events using Log4j2.
 *
 * <p>Levels:
 * <ul>
 *   <li>retry scheduled → INFO, marker {@code RETRY}</li>
 *   <li>attempts exhausted → WARN, marker {@code RETRY_EXHAUSTED}</li>
 *   <li>non-retryable failure or cancellation → WARN, marker {@code RETRY_ABORTED}</li>
 * </ul>
 */
public class Log4jRetryReporter implements RetryReporter {

	public static final String DEFAULT_LOGGER_NAME = "org.cloudplane.Retry";

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker RETRY_ABORTED_MARKER = MarkerManager.getMarker("RETRY_ABORTED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] failed, retrying in {} ms. {}",
				attemptNumber,
				operation,
				delay.toMillis(),
				describe(failure));
	}

	@Override
	public void reportRetryExhausted(String operation, Throwable failure, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Operation [{}] failed after {} attempts. {}",
				operation,
				totalAttempts,
				describe(failure));
	}

	@Override
	public void reportNonRetryable(String operation, Throwable failure, int attemptNumber) {
		logger.atWarn()
			.withMarker(RETRY_ABORTED_MARKER)
			.log("Operation [{}] failed on attempt {} with a non-retryable error. {}",
				operation,
				attemptNumber,
				describe(failure));
	}

	@Override
	public void reportCancelled(String operation, Throwable lastFailure, int attemptsMade) {
		logger.atWarn()
			.withMarker(RETRY_ABORTED_MARKER)
			.log("Operation [{}] cancelled after {} attempts. {}",
				operation,
				attemptsMade,
				describe(lastFailure));
	}

	private static String describe(Throwable failure) {
		if (failure == null) {
			return "No failure recorded";
		}
		if (failure instanceof ApiError apiError) {
			return "Code: %s, Status: %d, Message: %s".formatted(
				apiError.errorCode(), apiError.statusCode(), apiError.getMessage());
		}
		return "Type: %s, Message: %s".formatted(failure.getClass().getName(), failure.getMessage());
	}
}
