package org.cloudplane.api;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A structured error returned by the control-plane API.
 *
 * <p>Produced at the transport boundary (see {@link ApiErrorParser}) and consumed by retry
 * policies. It is a checked exception because an error response is an expected operational
 * condition rather than a programming defect.
 */
public class ApiError extends Exception {

    /**
     * Key in {@link #details()} holding the server's {@code Retry-After} value, in seconds.
     */
    public static final String RETRY_AFTER_DETAIL = "retry_after";

    // A day; anything longer is treated as a malformed header.
    private static final BigDecimal MAX_RETRY_AFTER_SECONDS = BigDecimal.valueOf(86_400);

    private final int statusCode;
    private final String errorCode;
    private final Map<String, Object> details;

    public ApiError(int statusCode, String errorCode, String message) {
        this(statusCode, errorCode, message, Map.of(), null);
    }

    public ApiError(int statusCode, String errorCode, String message, Map<String, ?> details) {
        this(statusCode, errorCode, message, details, null);
    }

    public ApiError(int statusCode, String errorCode, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode == null ? ErrorCodes.forStatus(statusCode) : errorCode;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public int statusCode() {
        return statusCode;
    }

    public String errorCode() {
        return errorCode;
    }

    /**
     * Additional fields from the error body. Values may be null; the map itself is read-only.
     */
    public Map<String, Object> details() {
        return details;
    }

    public StatusClass statusClass() {
        return StatusClass.of(statusCode);
    }

    public boolean isBadRequest() {
        return statusCode == 400;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isForbidden() {
        return statusCode == 403;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    /**
     * Returns the server's suggested wait before retrying.
     *
     * <p>Only rate-limit responses carry the hint. The value must be a non-negative number
     * of seconds, fractions allowed; anything else yields empty.
     *
     * @return the hinted wait, or empty if absent or unparseable
     */
    public Optional<Duration> retryAfter() {
        if (!isRateLimited()) {
            return Optional.empty();
        }
        Object raw = details.get(RETRY_AFTER_DETAIL);
        if (raw == null) {
            return Optional.empty();
        }
        BigDecimal seconds;
        try {
            seconds = new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (seconds.signum() < 0 || seconds.compareTo(MAX_RETRY_AFTER_SECONDS) > 0) {
            return Optional.empty();
        }
        long whole = seconds.longValue();
        long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
        return Optional.of(Duration.ofSeconds(whole, nanos));
    }

    @Override
    public String toString() {
        return "ApiError[" + errorCode + " (" + statusCode + "): " + getMessage() + "]";
    }
}
