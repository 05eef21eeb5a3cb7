package org.javai.callguard;

import java.util.List;
import java.util.Objects;

/**
 * The terminal error for an operation whose transient failures outlasted its retry budget.
 *
 * <p>The cause is the raw exception of the last attempt.</p>
 */
public class RetriesExhaustedException extends RuntimeException {

    private final Failure lastFailure;
    private final List<Attempt> history;

    public RetriesExhaustedException(Failure lastFailure, List<Attempt> history) {
        super("Operation [" + lastFailure.operation() + "] failed after " + history.size()
                + " attempts: " + lastFailure.message(), lastFailure.exception());
        this.lastFailure = Objects.requireNonNull(lastFailure, "lastFailure must not be null");
        this.history = List.copyOf(history);
    }

    /**
     * @return the total number of attempts made
     */
    public int attempts() {
        return history.size();
    }

    public Failure lastFailure() {
        return lastFailure;
    }

    /**
     * @return every attempt in the order they were made
     */
    public List<Attempt> history() {
        return history;
    }
}
