package org.cloudplane.retry;

import org.cloudplane.api.ApiError;

import java.util.Objects;

/**
 * Decides whether a structured API error is worth retrying.
 *
 * <p>Three presets cover the usual operational stances; any lambda over {@link ApiError}
 * works as a custom policy. Client errors other than rate limiting are not retried by any
 * preset, since resending a rejected request cannot succeed.
 *
 * <p>Every policy must return {@code false} for a null error.
 */
@FunctionalInterface
public interface ClassificationPolicy {

    /**
     * @param error the error returned by the failed attempt (may be null)
     * @return true if another attempt may succeed
     */
    boolean isRetryable(ApiError error);

    /**
     * Retries rate limiting (429) and any server error (status 500 and above).
     */
    static ClassificationPolicy defaultPolicy() {
        return PolicyPresets.DEFAULT;
    }

    /**
     * Retries rate limiting (429) and the whole 500-599 range, including 502, 503 and 504.
     */
    static ClassificationPolicy aggressive() {
        return PolicyPresets.AGGRESSIVE;
    }

    /**
     * Retries only rate limiting (429), 503 Service Unavailable and 504 Gateway Timeout.
     *
     * <p>A bare 500 or a 502 more often points at a persistent fault behind the gateway than
     * at load, so neither is retried.
     */
    static ClassificationPolicy conservative() {
        return PolicyPresets.CONSERVATIVE;
    }

    /**
     * Returns a policy that never retries.
     */
    static ClassificationPolicy never() {
        return PolicyPresets.NEVER;
    }

    /**
     * Returns a policy that retries when either this policy or {@code other} does.
     */
    default ClassificationPolicy or(ClassificationPolicy other) {
        Objects.requireNonNull(other, "other must not be null");
        return error -> isRetryable(error) || other.isRetryable(error);
    }
}
