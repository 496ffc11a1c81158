package org.cloudplane.retry;

/**
 * Thrown by {@link Retrier} when it gives up for a reason other than a non-retryable error.
 *
 * <p>A non-retryable error is rethrown unchanged, so catching this type separates
 * "gave up after retrying" and "cancelled" from "failed for good on the spot". The last
 * underlying failure, if any, is the {@link #getCause() cause}.
 */
public abstract sealed class RetryException extends Exception
        permits RetryExhaustedException, RetryCancelledException {

    private final int attempts;

    RetryException(String message, Throwable lastFailure, int attempts) {
        super(message, lastFailure);
        this.attempts = attempts;
    }

    /**
     * @return the number of times the operation was invoked
     */
    public int attempts() {
        return attempts;
    }

    /**
     * @return the failure of the last attempt, or null if no attempt was made
     */
    public Throwable lastFailure() {
        return getCause();
    }
}
