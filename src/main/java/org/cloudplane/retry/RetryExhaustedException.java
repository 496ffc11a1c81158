package org.cloudplane.retry;

/**
 * Every allowed attempt failed with a retryable error.
 */
public final class RetryExhaustedException extends RetryException {

    RetryExhaustedException(Attempt last) {
        super("operation failed after " + last.number() + " attempts: " + describe(last.error()),
                last.error(),
                last.number());
    }

    private static String describe(Exception error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
