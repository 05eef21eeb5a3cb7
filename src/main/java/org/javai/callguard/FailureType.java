package org.javai.callguard;

/**
 * Classifies failures by whether another attempt could succeed.
 */
public enum FailureType {
    /**
     * The call may succeed if repeated.
     * Examples: connection refused, timeout, HTTP 503, rate limited.
     */
    TRANSIENT,

    /**
     * Repeating the call will fail the same way.
     * Examples: validation rejected, HTTP 404, bad credentials.
     */
    PERMANENT,

    /**
     * A programming error on the caller's side. Never retried.
     * Examples: null pointer, illegal argument.
     */
    DEFECT
}
