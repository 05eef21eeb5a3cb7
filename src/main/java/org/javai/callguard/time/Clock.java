package org.javai.callguard.time;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Source of time and delays for every component that waits.
 *
 * <p>Injected everywhere so that tests can substitute a clock that only moves when told to.</p>
 */
public interface Clock {

    /**
     * @return the current instant
     */
    Instant now();

    /**
     * Returns a future that completes once {@code delay} has elapsed.
     * A zero or negative delay yields an already-completed future.
     * Cancelling the returned future cancels the underlying timer.
     *
     * @param delay how long to wait
     * @return a future completing after the delay
     */
    CompletableFuture<Void> after(Duration delay);

    /**
     * @return the process-wide clock backed by the system time and a shared timer thread
     */
    static Clock system() {
        return SystemClock.shared();
    }
}
