package org.cloudplane.retry;

import java.time.Duration;

/**
 * One failed invocation inside a single {@link Retrier} call.
 *
 * @param number the attempt number (1-based)
 * @param error what the attempt threw
 * @param delay the wait chosen before the next attempt, zero if there is none
 */
record Attempt(int number, Exception error, Duration delay) {

    Attempt withDelay(Duration delay) {
        return new Attempt(number, error, delay);
    }
}
