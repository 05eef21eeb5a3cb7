package org.javai.callguard;

import java.time.Duration;
import java.util.Objects;

/**
 * A transient failure raised when work did not settle within its time limit.
 * Used for per-attempt timeouts and health check timeouts.
 */
public class TimeoutFailureException extends TransientFailureException {

    public static final FailureId KIND = FailureId.of("timeout", "deadline_exceeded");

    private final String operation;
    private final Duration timeout;

    public TimeoutFailureException(String operation, Duration timeout) {
        super(KIND, "[" + operation + "] timed out after " + timeout.toMillis() + "ms");
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.timeout = timeout;
    }

    public String operation() {
        return operation;
    }

    public Duration timeout() {
        return timeout;
    }
}
