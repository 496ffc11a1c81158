package org.cloudplane.retry;

import java.util.Objects;

/**
 * Applies a {@link ClassificationPolicy} to whatever an attempt threw.
 *
 * <p>Unclassifiable failures are never retryable: an error we cannot interpret ends the
 * loop instead of being retried blindly.
 */
public final class ErrorClassifier {

    private final ClassificationPolicy policy;

    public ErrorClassifier(ClassificationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * @param failure the failure thrown by an attempt (may be null)
     * @return true if the failure should be retried
     */
    public boolean isRetryable(Throwable failure) {
        return isRetryable(ErrorKind.of(failure));
    }

    public boolean isRetryable(ErrorKind kind) {
        if (kind instanceof ErrorKind.Structured structured) {
            return policy.isRetryable(structured.error());
        }
        return false;
    }
}
