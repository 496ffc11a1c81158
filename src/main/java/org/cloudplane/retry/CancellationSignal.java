package org.cloudplane.retry;

import java.time.Duration;

/**
 * An externally owned signal that aborts a retry loop.
 *
 * <p>The {@link Retrier} checks the signal before every attempt and waits on it between
 * attempts, so a cancelled signal stops the loop at the next of those two points. A timeout
 * is a signal that fires on its own at a deadline (see {@link CancellationToken#withTimeout}).
 */
public interface CancellationSignal {

    /**
     * @return true once the signal has fired
     */
    boolean isCancelled();

    /**
     * Blocks until the signal fires or {@code timeout} elapses, whichever comes first.
     *
     * @param timeout the longest time to block
     * @return true if the signal fired
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean await(Duration timeout) throws InterruptedException;

    /**
     * A signal that never fires. Waiting on it simply sleeps.
     */
    static CancellationSignal none() {
        return NoCancellation.INSTANCE;
    }
}
