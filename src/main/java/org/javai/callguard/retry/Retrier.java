package org.javai.callguard.retry;

import org.javai.callguard.Attempt;
import org.javai.callguard.Failure;
import org.javai.callguard.Futures;
import org.javai.callguard.Operation;
import org.javai.callguard.Outcome;
import org.javai.callguard.RetriesExhaustedException;
import org.javai.callguard.boundary.Boundary;
import org.javai.callguard.boundary.DefaultFailureClassifier;
import org.javai.callguard.boundary.FailureClassifier;
import org.javai.callguard.ops.CompositeOpReporter;
import org.javai.callguard.ops.OpReporter;
import org.javai.callguard.time.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs operations under a retry policy without blocking a thread between attempts.
 *
 * <p>Each failed attempt is classified once by the {@link Boundary}; the policy then decides
 * whether to wait and try again. When the policy gives up the caller's future fails with:</p>
 * <ul>
 *   <li>{@link RetriesExhaustedException} if the failure was retryable but attempts ran out,</li>
 *   <li>the operation's own exception, unchanged, if the failure was not retryable.</li>
 * </ul>
 *
 * <p>Cancelling the returned future cancels the running attempt or the pending delay and
 * no further attempt is started.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.backoff(RetryConfig.defaults()))
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * CompletableFuture<User> user = retrier.execute("user:1", () -> client.fetchUser(1));
 * }</pre>
 */
public final class Retrier {

    private final RetryPolicy policy;
    private final Boundary boundary;
    private final OpReporter reporter;
    private final Clock clock;

    private Retrier(RetryPolicy policy, Boundary boundary, OpReporter reporter, Clock clock) {
        this.policy = policy;
        this.boundary = boundary;
        this.reporter = reporter;
        this.clock = clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RetryPolicy policy = RetryPolicy.backoff(RetryConfig.defaults());
        private FailureClassifier classifier = new DefaultFailureClassifier();
        private OpReporter reporter = OpReporter.noOp();
        private Clock clock = Clock.system();

        private Builder() {}

        /**
         * Sets the default policy (optional, defaults to {@link RetryConfig#defaults()} backoff).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Retrier build() {
            // reporter failures are logged by the composite and never reach the attempt loop
            OpReporter guarded = CompositeOpReporter.of(reporter);
            return new Retrier(policy, Boundary.of(classifier, guarded, clock), guarded, clock);
        }
    }

    /**
     * Executes an operation under the default policy.
     */
    public <T> CompletableFuture<T> execute(String operation, Operation<T> work) {
        return execute(operation, policy, work);
    }

    /**
     * Executes an operation under the given policy.
     *
     * @param operation The operation key, used for classification and reporting
     * @param policy The policy deciding on retries for this call
     * @param work The operation, started once per attempt
     * @return a future with the first successful value or the terminal error
     */
    public <T> CompletableFuture<T> execute(String operation, RetryPolicy policy, Operation<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(work, "work must not be null");

        Run<T> run = new Run<>(operation, policy, work);
        run.attempt(RetryContext.first(clock.now()));
        return run.result;
    }

    private final class Run<T> {
        private final String operation;
        private final RetryPolicy policy;
        private final Operation<T> work;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        // attempts run one after another, each settling before the next starts
        private final List<Attempt> history = new ArrayList<>();
        private volatile CompletableFuture<?> current;

        Run(String operation, RetryPolicy policy, Operation<T> work) {
            this.operation = operation;
            this.policy = policy;
            this.work = work;
            result.whenComplete((ignored, error) -> {
                if (result.isCancelled()) {
                    CompletableFuture<?> pending = current;
                    if (pending != null) {
                        pending.cancel(true);
                    }
                }
            });
        }

        void attempt(RetryContext context) {
            if (result.isDone()) {
                return;
            }
            Instant startedAt = clock.now();
            CompletableFuture<T> inflight = Futures.start(work);
            current = inflight;
            if (result.isCancelled()) {
                inflight.cancel(true);
                return;
            }
            boundary.observe(operation, context.attemptNumber(), inflight)
                    .whenComplete((outcome, error) -> {
                        if (error != null) {
                            // the attempt was cancelled
                            result.completeExceptionally(Futures.unwrap(error));
                            return;
                        }
                        settle(context, startedAt, outcome);
                    });
        }

        private void settle(RetryContext context, Instant startedAt, Outcome<T> outcome) {
            if (outcome instanceof Outcome.Ok<T> ok) {
                history.add(Attempt.succeeded(context.attemptNumber(), startedAt));
                result.complete(ok.value());
                return;
            }
            Failure failure = ((Outcome.Fail<T>) outcome).failure();
            history.add(Attempt.failed(context.attemptNumber(), startedAt, failure));
            if (result.isDone()) {
                return;
            }

            RetryDecision decision = policy.decide(context, failure);
            if (decision instanceof RetryDecision.Retry retry) {
                reporter.reportRetryAttempt(failure, context.attemptNumber(), retry.delay());
                waitThenRetry(context, retry.delay());
            } else {
                RetryDecision.GiveUp giveUp = (RetryDecision.GiveUp) decision;
                reporter.reportGaveUp(failure, context.attemptNumber(), giveUp.reason());
                result.completeExceptionally(terminalError(failure, giveUp));
            }
        }

        private void waitThenRetry(RetryContext context, Duration delay) {
            CompletableFuture<Void> pause = clock.after(delay);
            current = pause;
            if (result.isCancelled()) {
                pause.cancel(false);
                return;
            }
            pause.thenRun(() -> attempt(context.next(clock.now())));
        }

        private Throwable terminalError(Failure failure, RetryDecision.GiveUp giveUp) {
            if (giveUp.exhausted()) {
                return new RetriesExhaustedException(failure, history);
            }
            return failure.exception();
        }
    }
}
