package org.cloudplane.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry settings. One instance may back any number of concurrent calls.
 *
 * <p>Out-of-range values are clamped rather than rejected: {@code maxAttempts} to at least 1,
 * negative durations to zero, {@code multiplier} to at least 1.0 so backoff never shrinks.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryConfiguration config = RetryConfiguration.builder()
 *     .maxAttempts(3)
 *     .initialBackoff(Duration.ofMillis(200))
 *     .classificationPolicy(ClassificationPolicy.conservative())
 *     .build();
 *
 * RetryConfiguration slower = config.toBuilder().multiplier(3.0).build();
 * }</pre>
 *
 * @param maxAttempts total tries including the first one
 * @param initialBackoff wait before the second attempt
 * @param maxBackoff ceiling on any computed wait
 * @param multiplier growth factor applied per retry
 * @param jitterEnabled whether to perturb computed waits by up to 20%
 * @param classificationPolicy decides which API errors are retried
 */
public record RetryConfiguration(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double multiplier,
        boolean jitterEnabled,
        ClassificationPolicy classificationPolicy
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    public RetryConfiguration {
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        Objects.requireNonNull(classificationPolicy, "classificationPolicy must not be null");
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff.isNegative() ? Duration.ZERO : maxBackoff;
        // !(x >= 1.0) also catches NaN
        multiplier = !(multiplier >= 1.0) ? 1.0 : multiplier;
    }

    /**
     * 5 attempts, 1s initial backoff, 60s cap, multiplier 2.0, jitter on, default policy.
     */
    public static RetryConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder seeded with this configuration. Building from it never affects this instance.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .multiplier(multiplier)
                .jitter(jitterEnabled)
                .classificationPolicy(classificationPolicy);
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private double multiplier = DEFAULT_MULTIPLIER;
        private boolean jitterEnabled = true;
        private ClassificationPolicy classificationPolicy = ClassificationPolicy.defaultPolicy();

        private Builder() {}

        /**
         * Sets the total number of attempts, including the first. Values below 1 become 1.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder jitter(boolean enabled) {
            this.jitterEnabled = enabled;
            return this;
        }

        /**
         * Sets the classification policy. A null policy leaves the current one in place.
         */
        public Builder classificationPolicy(ClassificationPolicy policy) {
            if (policy != null) {
                this.classificationPolicy = policy;
            }
            return this;
        }

        public RetryConfiguration build() {
            return new RetryConfiguration(maxAttempts, initialBackoff, maxBackoff,
                    multiplier, jitterEnabled, classificationPolicy);
        }
    }
}
