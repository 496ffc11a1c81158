package org.cloudplane.retry;

import org.cloudplane.api.StatusClass;

/**
 * Shared instances behind the {@link ClassificationPolicy} factories, so that configurations
 * built from the same preset compare equal.
 */
final class PolicyPresets {

    static final ClassificationPolicy DEFAULT = error ->
            error != null && (error.isRateLimited() || error.isServerError());

    static final ClassificationPolicy AGGRESSIVE = error ->
            error != null && (error.statusClass() == StatusClass.RATE_LIMITED
                    || error.statusClass() == StatusClass.SERVER_ERROR);

    static final ClassificationPolicy CONSERVATIVE = error -> {
        if (error == null) {
            return false;
        }
        int code = error.statusCode();
        return code == 429 || code == 503 || code == 504;
    };

    static final ClassificationPolicy NEVER = error -> false;

    private PolicyPresets() {}
}
