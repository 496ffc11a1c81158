package org.cloudplane.retry;

import org.cloudplane.api.ApiError;
import org.cloudplane.api.ErrorCodes;
import org.cloudplane.ops.RetryReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetrierTest {

    private List<String> events;
    private RetryReporter reporter;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        reporter = new RetryReporter() {
            @Override
            public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
                events.add("retry:" + attemptNumber + ":" + delay.toMillis());
            }

            @Override
            public void reportRetryExhausted(String operation, Throwable failure, int totalAttempts) {
                events.add("exhausted:" + totalAttempts);
            }

            @Override
            public void reportNonRetryable(String operation, Throwable failure, int attemptNumber) {
                events.add("non-retryable:" + attemptNumber);
            }

            @Override
            public void reportCancelled(String operation, Throwable lastFailure, int attemptsMade) {
                events.add("cancelled:" + attemptsMade);
            }
        };
    }

    private Retrier retrier(int maxAttempts, ClassificationPolicy policy) {
        return Retrier.builder()
                .configuration(RetryConfiguration.builder()
                        .maxAttempts(maxAttempts)
                        .initialBackoff(Duration.ofMillis(10))
                        .maxBackoff(Duration.ofMillis(100))
                        .multiplier(2.0)
                        .jitter(false)
                        .classificationPolicy(policy)
                        .build())
                .reporter(reporter)
                .build();
    }

    private Retrier retrier(int maxAttempts) {
        return retrier(maxAttempts, ClassificationPolicy.defaultPolicy());
    }

    @Test
    void execute_success_returnsValueWithoutWaiting() throws Exception {
        RecordingSignal signal = new RecordingSignal();
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier(5).execute("Op", signal, () -> {
            attempts.incrementAndGet();
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(signal.waits()).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    void execute_clientError_failsFastWithOriginalError() {
        RecordingSignal signal = new RecordingSignal();
        AtomicInteger attempts = new AtomicInteger();
        ApiError notFound = new ApiError(404, ErrorCodes.NOT_FOUND, "Resource not found");

        assertThatThrownBy(() -> retrier(10).execute("Op", signal, () -> {
            attempts.incrementAndGet();
            throw notFound;
        })).isSameAs(notFound);

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(signal.waits()).isEmpty();
        assertThat(events).containsExactly("non-retryable:1");
    }

    @Test
    void execute_serverErrorEveryTime_exhaustsAttempts() {
        RecordingSignal signal = new RecordingSignal();
        AtomicInteger attempts = new AtomicInteger();
        ApiError unavailable = new ApiError(503, ErrorCodes.SERVICE_UNAVAILABLE, "Service unavailable");

        Throwable thrown = catchThrowable(() -> retrier(4).execute("Op", signal, () -> {
            attempts.incrementAndGet();
            throw unavailable;
        }));

        assertThat(attempts.get()).isEqualTo(4);
        assertThat(thrown)
                .isInstanceOf(RetryExhaustedException.class)
                .hasMessage("operation failed after 4 attempts: Service unavailable")
                .hasCause(unavailable);
        assertThat(((RetryException) thrown).attempts()).isEqualTo(4);
        assertThat(((RetryException) thrown).lastFailure()).isSameAs(unavailable);
        assertThat(signal.waits()).containsExactly(
                Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40));
        assertThat(events).containsExactly("retry:1:10", "retry:2:20", "retry:3:40", "exhausted:4");
    }

    @Test
    void execute_singleAttemptBudget_exhaustsWithoutWaiting() {
        RecordingSignal signal = new RecordingSignal();

        assertThatThrownBy(() -> retrier(1).execute("Op", signal, () -> {
            throw new ApiError(500, ErrorCodes.INTERNAL_SERVER_ERROR, "boom");
        })).isInstanceOf(RetryExhaustedException.class)
                .hasMessageContaining("after 1 attempts");

        assertThat(signal.waits()).isEmpty();
    }

    @Test
    void execute_recoversOnThirdAttempt() throws Exception {
        RecordingSignal signal = new RecordingSignal();
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier(5).execute("Op", signal, () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ApiError(500, ErrorCodes.INTERNAL_SERVER_ERROR, "Internal server error");
            }
            return "success on attempt 3";
        });

        assertThat(result).isEqualTo("success on attempt 3");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(signal.waits()).hasSize(2);
    }

    @Test
    void execute_rateLimitWithRetryAfter_overridesCalculatedBackoff() throws Exception {
        RecordingSignal signal = new RecordingSignal();
        AtomicInteger attempts = new AtomicInteger();
        Retrier slow = Retrier.builder()
                .configuration(RetryConfiguration.builder()
                        .maxAttempts(3)
                        .initialBackoff(Duration.ofSeconds(10))
                        .jitter(false)
                        .build())
                .build();

        slow.execute("Op", signal, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw rateLimited("0.05");
            }
            return "done";
        });

        assertThat(signal.waits()).containsExactly(Duration.ofMillis(50));
    }

    @Test
    void execute_rateLimitWithZeroRetryAfter_usesCalculatedBackoff() {
        RecordingSignal signal = new RecordingSignal();

        catchThrowable(() -> retrier(3).execute("Op", signal, () -> {
            throw rateLimited("0");
        }));

        assertThat(signal.waits()).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
    }

    @Test
    void execute_rateLimitWithoutRetryAfter_usesCalculatedBackoff() {
        RecordingSignal signal = new RecordingSignal();

        catchThrowable(() -> retrier(2).execute("Op", signal, () -> {
            throw new ApiError(429, ErrorCodes.RATE_LIMIT_EXCEEDED, "Rate limit exceeded");
        }));

        assertThat(signal.waits()).containsExactly(Duration.ofMillis(10));
    }

    @Test
    void execute_retryAfterOnServerError_isIgnored() {
        RecordingSignal signal = new RecordingSignal();

        catchThrowable(() -> retrier(2).execute("Op", signal, () -> {
            throw new ApiError(503, ErrorCodes.SERVICE_UNAVAILABLE, "busy",
                    Map.of(ApiError.RETRY_AFTER_DETAIL, "30"));
        }));

        assertThat(signal.waits()).containsExactly(Duration.ofMillis(10));
    }

    @Test
    void execute_cancelledDuringWait_stopsBeforeSecondAttempt() {
        RecordingSignal signal = new RecordingSignal(1);
        AtomicInteger attempts = new AtomicInteger();
        ApiError unavailable = new ApiError(503, ErrorCodes.SERVICE_UNAVAILABLE, "Service unavailable");

        Throwable thrown = catchThrowable(() -> retrier(5).execute("Op", signal, () -> {
            attempts.incrementAndGet();
            throw unavailable;
        }));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(thrown)
                .isInstanceOf(RetryCancelledException.class)
                .hasMessage("retry cancelled after attempt 1")
                .hasCause(unavailable);
        assertThat(((RetryCancelledException) thrown).attempts()).isEqualTo(1);
        assertThat(events).containsExactly("retry:1:10", "cancelled:1");
    }

    @Test
    void execute_alreadyCancelled_neverInvokesOperation() {
        AtomicInteger attempts = new AtomicInteger();

        Throwable thrown = catchThrowable(() -> retrier(5).execute("Op", RecordingSignal.alreadyCancelled(), () -> {
            attempts.incrementAndGet();
            return "never";
        }));

        assertThat(attempts.get()).isZero();
        assertThat(thrown)
                .isInstanceOf(RetryCancelledException.class)
                .hasMessage("retry cancelled before the first attempt")
                .hasNoCause();
        assertThat(events).containsExactly("cancelled:0");
    }

    @Test
    void execute_unclassifiableCheckedException_isNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        IOException ioFailure = new IOException("connection reset");

        assertThatThrownBy(() -> retrier(5).execute("Op", new RecordingSignal(), () -> {
            attempts.incrementAndGet();
            throw ioFailure;
        })).isSameAs(ioFailure);

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_runtimeException_propagatesUnchanged() {
        AtomicInteger attempts = new AtomicInteger();
        IllegalStateException defect = new IllegalStateException("bug");

        assertThatThrownBy(() -> retrier(5).execute("Op", new RecordingSignal(), () -> {
            attempts.incrementAndGet();
            throw defect;
        })).isSameAs(defect);

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(events).containsExactly("non-retryable:1");
    }

    @Test
    void execute_conservativePolicy_doesNotRetryInternalServerError() {
        AtomicInteger attempts = new AtomicInteger();

        Throwable thrown = catchThrowable(() -> retrier(3, ClassificationPolicy.conservative())
                .execute("Op", new RecordingSignal(), () -> {
                    attempts.incrementAndGet();
                    throw new ApiError(500, ErrorCodes.INTERNAL_SERVER_ERROR, "Internal server error");
                }));

        assertThat(thrown).isInstanceOf(ApiError.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_customPolicy_isConsulted() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ClassificationPolicy conflictsToo = ClassificationPolicy.defaultPolicy()
                .or(error -> error != null && error.isConflict());

        String result = retrier(3, conflictsToo).execute("Op", new RecordingSignal(), () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new ApiError(409, ErrorCodes.CONFLICT, "Cluster is being updated");
            }
            return "updated";
        });

        assertThat(result).isEqualTo("updated");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void run_voidOperation_retriesUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        retrier(3).run("Op", new RecordingSignal(), () -> {
            if (attempts.incrementAndGet() < 2) {
                throw new ApiError(502, ErrorCodes.BAD_GATEWAY, "Bad gateway");
            }
        });

        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void execute_interruptedWhileWaiting_reportsCancellationAndKeepsInterruptFlag() {
        Retrier realWaits = Retrier.builder()
                .configuration(RetryConfiguration.builder()
                        .maxAttempts(3)
                        .initialBackoff(Duration.ofSeconds(30))
                        .jitter(false)
                        .build())
                .build();

        Thread.currentThread().interrupt();
        Throwable thrown;
        try {
            thrown = catchThrowable(() -> realWaits.execute("Op", () -> {
                throw new ApiError(503, ErrorCodes.SERVICE_UNAVAILABLE, "busy");
            }));
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(thrown).isInstanceOf(RetryCancelledException.class);
        assertThat(thrown.getSuppressed()).hasOnlyElementsOfType(InterruptedException.class);
    }

    private static RetryReporter throwingReporter() {
        return new RetryReporter() {
            @Override
            public void reportRetryAttempt(String operation, Throwable failure, int attemptNumber, Duration delay) {
                throw new IllegalStateException("reporter broke");
            }

            @Override
            public void reportRetryExhausted(String operation, Throwable failure, int totalAttempts) {
                throw new IllegalStateException("reporter broke");
            }

            @Override
            public void reportNonRetryable(String operation, Throwable failure, int attemptNumber) {
                throw new IllegalStateException("reporter broke");
            }

            @Override
            public void reportCancelled(String operation, Throwable lastFailure, int attemptsMade) {
                throw new IllegalStateException("reporter broke");
            }
        };
    }

    private Retrier retrierWithBrokenReporter(int maxAttempts) {
        return Retrier.builder()
                .configuration(RetryConfiguration.builder()
                        .maxAttempts(maxAttempts)
                        .initialBackoff(Duration.ZERO)
                        .jitter(false)
                        .build())
                .reporter(throwingReporter())
                .build();
    }

    @Test
    void execute_failingReporterOnNonRetryable_rethrowsOriginalError() {
        ApiError notFound = new ApiError(404, ErrorCodes.NOT_FOUND, "Topic not found");

        Throwable thrown = catchThrowable(() -> retrierWithBrokenReporter(3).execute("Topics.get", () -> {
            throw notFound;
        }));

        assertThat(thrown).isSameAs(notFound);
    }

    @Test
    void execute_failingReporterOnExhaustion_stillWrapsLastError() {
        ApiError unavailable = new ApiError(503, ErrorCodes.SERVICE_UNAVAILABLE, "busy");
        AtomicInteger calls = new AtomicInteger();

        Throwable thrown = catchThrowable(() -> retrierWithBrokenReporter(3).execute("Topics.get", () -> {
            calls.incrementAndGet();
            throw unavailable;
        }));

        assertThat(calls).hasValue(3);
        assertThat(thrown).isInstanceOf(RetryExhaustedException.class).hasCause(unavailable);
    }

    @Test
    void execute_failingReporterOnCancellation_stillReportsCancellation() {
        Throwable thrown = catchThrowable(() -> retrierWithBrokenReporter(3)
                .execute("Topics.get", RecordingSignal.alreadyCancelled(), () -> "never"));

        assertThat(thrown).isInstanceOf(RetryCancelledException.class);
    }

    @Test
    void builder_defaultsToDefaultConfiguration() {
        Retrier retrier = Retrier.builder().build();

        assertThat(retrier.configuration()).isEqualTo(RetryConfiguration.defaults());
    }

    private static ApiError rateLimited(String retryAfterSeconds) {
        return new ApiError(429, ErrorCodes.RATE_LIMIT_EXCEEDED, "Rate limit exceeded",
                Map.of(ApiError.RETRY_AFTER_DETAIL, retryAfterSeconds));
    }
}
