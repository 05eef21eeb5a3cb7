package org.javai.callguard;

import java.time.Instant;
import java.util.Objects;

/**
 * A record of one execution of an operation.
 *
 * @param number 1-based attempt number
 * @param startedAt when the attempt was started
 * @param succeeded whether the attempt produced a value
 * @param failureKind the classified kind when the attempt failed, otherwise null
 */
public record Attempt(int number, Instant startedAt, boolean succeeded, FailureId failureKind) {

    public Attempt {
        if (number < 1) {
            throw new IllegalArgumentException("number must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        if (succeeded && failureKind != null) {
            throw new IllegalArgumentException("a successful attempt has no failure kind");
        }
    }

    public static Attempt succeeded(int number, Instant startedAt) {
        return new Attempt(number, startedAt, true, null);
    }

    public static Attempt failed(int number, Instant startedAt, Failure failure) {
        return new Attempt(number, startedAt, false, failure.id());
    }
}
