package org.cloudplane.api;

/**
 * Coarse classification of an HTTP status code, as seen by retry policies.
 */
public enum StatusClass {
    /**
     * A 4xx response other than rate limiting. Retrying the same request cannot succeed.
     */
    CLIENT_ERROR,

    /**
     * 429 Too Many Requests. The server asked the caller to slow down.
     */
    RATE_LIMITED,

    /**
     * A 5xx response. The fault lies with the server and may be temporary.
     */
    SERVER_ERROR,

    /**
     * Anything outside the 4xx and 5xx ranges.
     */
    OTHER;

    /**
     * Maps a status code onto its class.
     *
     * @param statusCode the HTTP status code
     * @return the matching class, never null
     */
    public static StatusClass of(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 400 && statusCode <= 499) {
            return CLIENT_ERROR;
        }
        if (statusCode >= 500 && statusCode <= 599) {
            return SERVER_ERROR;
        }
        return OTHER;
    }
}
