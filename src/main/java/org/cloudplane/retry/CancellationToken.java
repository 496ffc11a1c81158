package org.cloudplane.retry;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A {@link CancellationSignal} fired explicitly with {@link #cancel()} or implicitly at an
 * optional deadline.
 *
 * <p>Waiting parks the calling thread on a latch with a timeout. No timer thread or scheduled
 * task is involved, so there is nothing to release when the wait ends either way.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(30));
 * Cluster cluster = retrier.execute("Clusters.get", token, () -> clusters.get(id));
 *
 * // from another thread
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken implements CancellationSignal {

    private final CountDownLatch fired = new CountDownLatch(1);
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * Creates a token that fires only when {@link #cancel()} is called.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    /**
     * Creates a token that fires after {@code timeout}, or earlier on {@link #cancel()}.
     * A timeout past {@link Instant#MAX} never fires on its own.
     */
    public static CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Clock clock = Clock.systemUTC();
        return new CancellationToken(saturatedDeadline(clock.instant(), timeout), clock);
    }

    /**
     * Creates a token that fires once {@code clock} reaches {@code deadline}, or earlier on {@link #cancel()}.
     */
    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(
                Objects.requireNonNull(deadline, "deadline must not be null"),
                Objects.requireNonNull(clock, "clock must not be null"));
    }

    /**
     * Fires the signal and wakes any thread waiting on it. Idempotent.
     */
    public void cancel() {
        fired.countDown();
    }

    @Override
    public boolean isCancelled() {
        return fired.getCount() == 0 || deadlinePassed();
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (isCancelled()) {
            return true;
        }
        Duration wait = timeout;
        boolean boundByDeadline = false;
        if (deadline != null) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.compareTo(wait) <= 0) {
                wait = remaining;
                boundByDeadline = true;
            }
        }
        long nanos = saturatedNanos(wait);
        boolean cancelledExplicitly = nanos > 0 && fired.await(nanos, TimeUnit.NANOSECONDS);
        // the latch and the clock tick separately, so a wait cut short by the deadline counts as fired
        return cancelledExplicitly || boundByDeadline || isCancelled();
    }

    /**
     * @return the deadline, or null if the token only fires on {@link #cancel()}
     */
    public Instant deadline() {
        return deadline;
    }

    private boolean deadlinePassed() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    static Instant saturatedDeadline(Instant start, Duration timeout) {
        try {
            return start.plus(timeout);
        } catch (DateTimeException | ArithmeticException e) {
            return timeout.isNegative() ? Instant.MIN : Instant.MAX;
        }
    }

    static long saturatedNanos(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            return 0;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
