package org.cloudplane.retry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudplane.api.ApiError;
import org.cloudplane.ops.RetryReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes control-plane API calls with retry.
 *
 * <p>Each call runs its attempts one after another on the calling thread. A failed attempt is
 * classified by the configured {@link ClassificationPolicy}; a retryable failure is followed
 * by a wait and another attempt until the attempt budget runs out. The wait is the server's
 * {@code Retry-After} hint for a rate-limited response that carries one, and the
 * {@link BackoffCalculator} result otherwise. The {@link CancellationSignal} is checked before
 * every attempt and interrupts the wait.
 *
 * <p>A call ends in one of four ways:
 * <ul>
 *   <li>the operation's result is returned;</li>
 *   <li>a non-retryable failure is rethrown unchanged, without further attempts;</li>
 *   <li>{@link RetryExhaustedException} wraps the last failure once the budget is used up;</li>
 *   <li>{@link RetryCancelledException} reports how many attempts ran before cancellation.</li>
 * </ul>
 *
 * <p>A Retrier holds no per-call state and may be shared between threads. A reporter that
 * throws is logged and ignored; it never replaces the outcome of the call.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .configuration(RetryConfiguration.builder()
 *         .maxAttempts(4)
 *         .classificationPolicy(ClassificationPolicy.conservative())
 *         .build())
 *     .reporter(new Log4jRetryReporter())
 *     .build();
 *
 * Topic topic = retrier.execute("Topics.create", token, () -> topics.create(spec));
 * }</pre>
 */
public final class Retrier {

    private static final Logger LOGGER = LogManager.getLogger(Retrier.class);

    private final RetryConfiguration configuration;
    private final ErrorClassifier classifier;
    private final BackoffCalculator calculator;
    private final RetryReporter reporter;

    private Retrier(RetryConfiguration configuration, RetryReporter reporter, RandomSource random) {
        this.configuration = configuration;
        this.classifier = new ErrorClassifier(configuration.classificationPolicy());
        this.calculator = new BackoffCalculator(configuration, random);
        this.reporter = reporter;
    }

    /**
     * Creates a Retrier with the given configuration and no reporting.
     */
    public static Retrier of(RetryConfiguration configuration) {
        return builder().configuration(configuration).build();
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryConfiguration configuration = RetryConfiguration.defaults();
        private RetryReporter reporter = RetryReporter.noOp();
        private RandomSource random = RandomSource.secure();

        private Builder() {}

        /**
         * Sets the retry configuration (optional, defaults to {@link RetryConfiguration#defaults()}).
         *
         * @param configuration the configuration to use
         * @return this builder
         */
        public Builder configuration(RetryConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the source of jitter (optional, defaults to {@link RandomSource#secure()}).
         *
         * @param random the random source, which must be safe for concurrent use
         * @return this builder
         */
        public Builder randomSource(RandomSource random) {
            this.random = Objects.requireNonNull(random, "random must not be null");
            return this;
        }

        public Retrier build() {
            return new Retrier(configuration, reporter, random);
        }
    }

    public RetryConfiguration configuration() {
        return configuration;
    }

    /**
     * Executes an operation with retry and no cancellation.
     *
     * @see #execute(String, CancellationSignal, ThrowingSupplier)
     */
    public <T, E extends Exception> T execute(String operation, ThrowingSupplier<T, E> work)
            throws E, RetryException {
        return execute(operation, CancellationSignal.none(), work);
    }

    /**
     * Executes an operation with retry.
     *
     * <p>{@code work} may be invoked up to {@code maxAttempts} times and must be safe to repeat.
     *
     * @param operation the operation name for reporting
     * @param signal aborts the loop when it fires
     * @param work the call to make
     * @return the result of the first successful attempt
     * @throws E the failure of an attempt that is not worth retrying, unchanged
     * @throws RetryExhaustedException if every attempt failed with a retryable error
     * @throws RetryCancelledException if the signal fired first
     */
    public <T, E extends Exception> T execute(String operation, CancellationSignal signal, ThrowingSupplier<T, E> work)
            throws E, RetryException {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(work, "work must not be null");

        int maxAttempts = configuration.maxAttempts();
        Attempt last = null;

        for (int attemptNumber = 1; ; attemptNumber++) {
            if (signal.isCancelled()) {
                throw cancelled(operation, attemptNumber - 1, last);
            }
            try {
                return work.get();
            } catch (Exception e) {
                ErrorKind kind = ErrorKind.of(e);
                if (!classifier.isRetryable(kind)) {
                    int failedAttempt = attemptNumber;
                    report("reportNonRetryable", () -> reporter.reportNonRetryable(operation, e, failedAttempt));
                    throw e;
                }
                last = new Attempt(attemptNumber, e, Duration.ZERO);
                if (attemptNumber >= maxAttempts) {
                    int totalAttempts = attemptNumber;
                    report("reportRetryExhausted", () -> reporter.reportRetryExhausted(operation, e, totalAttempts));
                    throw new RetryExhaustedException(last);
                }
                Attempt scheduled = last.withDelay(delayFor(kind, attemptNumber));
                last = scheduled;
                report("reportRetryAttempt",
                        () -> reporter.reportRetryAttempt(operation, e, scheduled.number(), scheduled.delay()));
                awaitNextAttempt(operation, signal, scheduled);
            }
        }
    }

    /**
     * Runs an action with retry and no cancellation.
     *
     * @see #execute(String, CancellationSignal, ThrowingSupplier)
     */
    public <E extends Exception> void run(String operation, ThrowingRunnable<E> work) throws E, RetryException {
        run(operation, CancellationSignal.none(), work);
    }

    /**
     * Runs an action with retry.
     *
     * @see #execute(String, CancellationSignal, ThrowingSupplier)
     */
    public <E extends Exception> void run(String operation, CancellationSignal signal, ThrowingRunnable<E> work)
            throws E, RetryException {
        Objects.requireNonNull(work, "work must not be null");
        execute(operation, signal, () -> {
            work.run();
            return null;
        });
    }

    /**
     * The server's hint wins over local backoff, but only for rate limiting and only when positive.
     */
    private Duration delayFor(ErrorKind kind, int attemptNumber) {
        if (kind instanceof ErrorKind.Structured structured) {
            ApiError error = structured.error();
            if (error.isRateLimited()) {
                Optional<Duration> retryAfter = error.retryAfter();
                if (retryAfter.isPresent() && !retryAfter.get().isZero()) {
                    return retryAfter.get();
                }
            }
        }
        return calculator.backoff(attemptNumber - 1);
    }

    private void awaitNextAttempt(String operation, CancellationSignal signal, Attempt attempt)
            throws RetryCancelledException {
        if (attempt.delay().isZero()) {
            return;
        }
        boolean fired;
        InterruptedException interruption = null;
        try {
            fired = signal.await(attempt.delay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interruption = e;
            fired = true;
        }
        if (fired) {
            RetryCancelledException cancelled = cancelled(operation, attempt.number(), attempt);
            if (interruption != null) {
                cancelled.addSuppressed(interruption);
            }
            throw cancelled;
        }
    }

    private RetryCancelledException cancelled(String operation, int attemptsMade, Attempt last) {
        Exception lastFailure = last == null ? null : last.error();
        report("reportCancelled", () -> reporter.reportCancelled(operation, lastFailure, attemptsMade));
        return new RetryCancelledException(attemptsMade, lastFailure);
    }

    private void report(String method, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            LOGGER.error("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
        }
    }
}
