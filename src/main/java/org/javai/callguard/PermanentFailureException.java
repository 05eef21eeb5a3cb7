package org.javai.callguard;

import java.util.Objects;

/**
 * Thrown by an operation to signal a failure that repeating the call cannot fix,
 * such as a rejected request or missing credentials. Never retried.
 */
public class PermanentFailureException extends RuntimeException {

    private final FailureId kind;

    public PermanentFailureException(FailureId kind, String message) {
        this(kind, message, null);
    }

    public PermanentFailureException(FailureId kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public FailureId kind() {
        return kind;
    }
}
