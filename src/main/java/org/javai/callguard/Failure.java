package org.javai.callguard;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A classified failure of one attempt, with the context needed for retry decisions and reporting.
 *
 * @param id The failure kind (namespace:name)
 * @param message Human-readable description
 * @param type The failure type (TRANSIENT, PERMANENT, DEFECT)
 * @param exception The raw exception the operation failed with (may be null)
 * @param retryAfter Suggested delay before retry (may be null)
 * @param operation The key of the operation that failed (e.g., "user:1")
 * @param attempt The 1-based attempt number that produced this failure
 * @param occurredAt When the failure was observed
 * @param tags Additional key-value metadata for observability
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        Throwable exception,
        Duration retryAfter,
        String operation,
        int attempt,
        Instant occurredAt,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Attaches call context to a classifier verdict.
     */
    public static Failure of(FailureKind kind, String operation, int attempt, Instant occurredAt, Throwable exception) {
        return new Failure(kind.id(), kind.message(), kind.type(), exception, kind.retryAfter(),
                operation, attempt, occurredAt, null);
    }

    /**
     * Creates a first-attempt transient failure observed now.
     */
    public static Failure transientFailure(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.TRANSIENT, exception, null,
                operation, 1, Instant.now(), null);
    }

    /**
     * Creates a first-attempt permanent failure observed now.
     */
    public static Failure permanentFailure(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.PERMANENT, exception, null,
                operation, 1, Instant.now(), null);
    }

    /**
     * Returns a copy with the given tags merged over the existing ones.
     */
    public Failure withTags(Map<String, String> extra) {
        Map<String, String> merged = new HashMap<>(tags);
        merged.putAll(extra);
        return new Failure(id, message, type, exception, retryAfter, operation, attempt, occurredAt, merged);
    }
}
