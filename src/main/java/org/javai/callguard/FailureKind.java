package org.javai.callguard;

import java.time.Duration;
import java.util.Objects;

/**
 * A classifier's verdict on an exception, before any call context is attached.
 * The {@link org.javai.callguard.boundary.Boundary} turns it into a full {@link Failure}.
 *
 * @param id The failure kind
 * @param message Human-readable description
 * @param type Whether the failure is transient, permanent or a defect
 * @param retryAfter Minimum delay the remote side asked for (may be null)
 */
public record FailureKind(FailureId id, String message, FailureType type, Duration retryAfter) {

    public FailureKind {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static FailureKind transientKind(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.TRANSIENT, null);
    }

    public static FailureKind permanent(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.PERMANENT, null);
    }

    public static FailureKind defect(FailureId id, String message) {
        return new FailureKind(id, message, FailureType.DEFECT, null);
    }

    /**
     * Returns a copy carrying the given retry-after hint.
     */
    public FailureKind withRetryAfter(Duration retryAfter) {
        return new FailureKind(id, message, type, retryAfter);
    }
}
