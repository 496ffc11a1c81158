package org.cloudplane.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

final class NoCancellation implements CancellationSignal {

    static final NoCancellation INSTANCE = new NoCancellation();

    private NoCancellation() {}

    @Override
    public boolean isCancelled() {
        return false;
    }

    @Override
    public boolean await(Duration timeout) throws InterruptedException {
        long nanos = CancellationToken.saturatedNanos(timeout);
        if (nanos > 0) {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
        return false;
    }
}
