package org.cloudplane.retry;

/**
 * The cancellation signal fired before the attempt budget was used up.
 */
public final class RetryCancelledException extends RetryException {

    RetryCancelledException(int attemptsMade, Throwable lastFailure) {
        super(attemptsMade == 0
                        ? "retry cancelled before the first attempt"
                        : "retry cancelled after attempt " + attemptsMade,
                lastFailure,
                attemptsMade);
    }
}
