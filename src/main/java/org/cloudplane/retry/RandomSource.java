package org.cloudplane.retry;

/**
 * Source of uniformly distributed values in {@code [0, 1)} used for backoff jitter.
 *
 * <p>Implementations must be safe for concurrent use. Tests substitute a fixed sequence.
 */
@FunctionalInterface
public interface RandomSource {

    double nextUnit();

    /**
     * A source backed by one shared {@link java.security.SecureRandom}.
     *
     * <p>Independent processes seeded this way do not draw correlated jitter, so their retries
     * do not line up into synchronized bursts against the server.
     */
    static RandomSource secure() {
        return SecureRandomSource.INSTANCE;
    }

    /**
     * A source that always returns {@code value}.
     */
    static RandomSource fixed(double value) {
        return () -> value;
    }
}
