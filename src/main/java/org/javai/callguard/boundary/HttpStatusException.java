package org.javai.callguard.boundary;

import java.io.IOException;
import java.time.Duration;

/**
 * Signals that an HTTP call completed with an unsuccessful status.
 *
 * <p>Status {@code 0} means no response was received at all, e.g. the connection dropped.
 * {@link DefaultFailureClassifier} maps the status onto a transient or permanent kind.</p>
 */
public class HttpStatusException extends IOException {

    private final int status;
    private final Duration retryAfter;

    public HttpStatusException(int status, String message) {
        this(status, message, null);
    }

    /**
     * @param status the HTTP status code, or 0 when no response arrived
     * @param message description, typically the status line
     * @param retryAfter the parsed Retry-After header (may be null)
     */
    public HttpStatusException(int status, String message, Duration retryAfter) {
        super(message);
        if (status < 0 || status > 599) {
            throw new IllegalArgumentException("status out of range: " + status);
        }
        this.status = status;
        this.retryAfter = retryAfter;
    }

    public int status() {
        return status;
    }

    /**
     * @return the Retry-After delay, or null when the response carried none
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
