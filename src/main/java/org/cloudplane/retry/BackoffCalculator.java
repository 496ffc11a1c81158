package org.cloudplane.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes the wait inserted before a retry.
 *
 * <p>The raw wait is {@code initialBackoff * multiplier^retriesSoFar}, capped at
 * {@code maxBackoff}. With jitter enabled the raw wait is perturbed by up to 20% either way
 * and never goes below zero. With jitter disabled the result depends only on the inputs.
 */
public final class BackoffCalculator {

    static final double JITTER_FRACTION = 0.2;

    private static final double MAX_NANOS = Long.MAX_VALUE;

    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;
    private final boolean jitterEnabled;
    private final RandomSource random;

    public BackoffCalculator(RetryConfiguration configuration) {
        this(configuration, RandomSource.secure());
    }

    public BackoffCalculator(RetryConfiguration configuration, RandomSource random) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        this.initialBackoff = configuration.initialBackoff();
        this.maxBackoff = configuration.maxBackoff();
        this.multiplier = configuration.multiplier();
        this.jitterEnabled = configuration.jitterEnabled();
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Returns the wait before the next attempt.
     *
     * @param retriesSoFar retries already performed: 0 before the second attempt, 1 before the third
     * @return a non-negative duration
     */
    public Duration backoff(int retriesSoFar) {
        Duration raw = rawBackoff(Math.max(0, retriesSoFar));
        if (!jitterEnabled) {
            return raw;
        }
        return jitter(raw);
    }

    private Duration rawBackoff(int retriesSoFar) {
        double maxNanos = nanos(maxBackoff);
        double nanos = nanos(initialBackoff) * Math.pow(multiplier, retriesSoFar);
        if (Double.isNaN(nanos) || nanos >= maxNanos) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }

    private Duration jitter(Duration raw) {
        double r = Math.min(1.0, Math.max(0.0, random.nextUnit()));
        double base = nanos(raw);
        double jittered = base + base * JITTER_FRACTION * (2 * r - 1);
        if (jittered <= 0 || Double.isNaN(jittered)) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) Math.min(jittered, MAX_NANOS));
    }

    private static double nanos(Duration duration) {
        return duration.getSeconds() * 1_000_000_000d + duration.getNano();
    }
}
