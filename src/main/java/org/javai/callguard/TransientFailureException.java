package org.javai.callguard;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by an operation to signal a failure that may clear up if the call is repeated.
 *
 * <p>Operations that know their own failure modes throw this (or
 * {@link PermanentFailureException}) so the classifier does not have to guess.</p>
 */
public class TransientFailureException extends RuntimeException {

    private final FailureId kind;
    private final Duration retryAfter;

    public TransientFailureException(FailureId kind, String message) {
        this(kind, message, null, null);
    }

    public TransientFailureException(FailureId kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    /**
     * @param kind the classified kind
     * @param message description of the failure
     * @param retryAfter minimum delay the remote side asked for (may be null)
     * @param cause the underlying exception (may be null)
     */
    public TransientFailureException(FailureId kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.retryAfter = retryAfter;
    }

    public FailureId kind() {
        return kind;
    }

    /**
     * @return the requested minimum delay, or null when the remote side gave none
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
