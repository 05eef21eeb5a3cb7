package org.javai.callguard.boundary;

import org.javai.callguard.Failure;
import org.javai.callguard.FailureKind;
import org.javai.callguard.Futures;
import org.javai.callguard.Operation;
import org.javai.callguard.Outcome;
import org.javai.callguard.ops.OpReporter;
import org.javai.callguard.time.Clock;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * The point where raw operation failures are classified.
 *
 * <p>Every failed attempt passes through here exactly once: the exception is classified,
 * reported, and turned into {@link Outcome.Fail}. Everything downstream (retry policy, cache,
 * facade) sees only the classified {@link Failure}. Cancellation is not a failure and is
 * passed through untouched.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.of(new DefaultFailureClassifier(), reporter, clock);
 *
 * CompletableFuture<Outcome<User>> result = boundary.call("user:1", () -> client.fetchUser(1));
 * }</pre>
 */
public final class Boundary {

    private final FailureClassifier classifier;
    private final OpReporter reporter;
    private final Clock clock;

    /**
     * Creates a Boundary with default classification, no reporting, and the system clock.
     */
    public static Boundary silent() {
        return new Boundary(new DefaultFailureClassifier(), OpReporter.noOp(), Clock.system());
    }

    public static Boundary of(FailureClassifier classifier, OpReporter reporter, Clock clock) {
        return new Boundary(classifier, reporter, clock);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter, Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts a single first attempt of {@code work} and classifies its result.
     */
    public <T> CompletableFuture<Outcome<T>> call(String operation, Operation<T> work) {
        return observe(operation, 1, Futures.start(work));
    }

    /**
     * Classifies the settlement of an attempt that is already running.
     *
     * @param operation the operation key
     * @param attempt the 1-based attempt number
     * @param inflight the running attempt
     * @return a future with the outcome; it fails only if the attempt was cancelled
     */
    public <T> CompletableFuture<Outcome<T>> observe(String operation, int attempt, CompletableFuture<T> inflight) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(inflight, "inflight must not be null");
        return inflight.handle((value, error) -> {
            if (error == null) {
                return Outcome.ok(value);
            }
            Throwable cause = Futures.unwrap(error);
            if (cause instanceof CancellationException cancelled) {
                throw cancelled;
            }
            return Outcome.fail(classify(operation, attempt, cause));
        });
    }

    /**
     * Classifies and reports a raw failure.
     */
    public Failure classify(String operation, int attempt, Throwable error) {
        FailureKind kind = classifier.classify(operation, error);
        Failure failure = Failure.of(kind, operation, attempt, clock.now(), error);
        reporter.report(failure);
        return failure;
    }
}
