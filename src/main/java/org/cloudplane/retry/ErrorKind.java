package org.cloudplane.retry;

import org.cloudplane.api.ApiError;

import java.util.Objects;

/**
 * The shape of a failure as far as retry classification is concerned.
 *
 * <p>Decoding happens once, at the boundary: either the failure is a {@link Structured}
 * API error that a {@link ClassificationPolicy} can judge, or it is {@link Unclassifiable}
 * and never retried.
 */
public sealed interface ErrorKind permits ErrorKind.Structured, ErrorKind.Unclassifiable {

    /**
     * Decodes a failure. Only the throwable itself is inspected, not its cause chain, so an
     * API error wrapped by some other layer counts as unclassifiable.
     *
     * @param failure the failure thrown by an attempt (may be null)
     * @return the decoded kind, never null
     */
    static ErrorKind of(Throwable failure) {
        if (failure instanceof ApiError apiError) {
            return new Structured(apiError);
        }
        return new Unclassifiable(failure);
    }

    /**
     * A failure that came from the API with a status code and optional hints.
     */
    record Structured(ApiError error) implements ErrorKind {
        public Structured {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    /**
     * A failure that did not originate from the API transport, or no failure object at all.
     */
    record Unclassifiable(Throwable failure) implements ErrorKind {
    }
}
