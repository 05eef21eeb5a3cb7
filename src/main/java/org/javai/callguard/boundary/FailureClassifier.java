package org.javai.callguard.boundary;

import org.javai.callguard.FailureKind;

/**
 * Decides what kind of failure an exception represents.
 * Implementations must be deterministic: the same exception always yields the same kind.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception raised by an operation.
     *
     * @param operation The key of the operation that failed
     * @param throwable The raw exception
     * @return A classified FailureKind, never null
     */
    FailureKind classify(String operation, Throwable throwable);
}
