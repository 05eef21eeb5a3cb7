package org.javai.callguard;

import org.javai.callguard.boundary.HttpStatusException;
import org.javai.callguard.ops.OpReporter;
import org.javai.callguard.retry.RetryConfig;
import org.javai.callguard.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class OrchestratorTest {

    private ManualClock clock;
    private List<Failure> reported;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        reported = new ArrayList<>();
        orchestrator = Orchestrator.builder()
                .config(OrchestratorConfig.builder()
                        .ttl(Duration.ofMillis(1000))
                        .maxConcurrency(2)
                        .retry(RetryConfig.builder()
                                .maxAttempts(3)
                                .baseDelay(Duration.ofMillis(100))
                                .backoffMultiplier(2.0)
                                .build())
                        .build())
                .clock(clock)
                .reporter(reported::add)
                .jitter(() -> 0.5)
                .build();
    }

    @Test
    void execute_transientTwiceThenSuccess_retriesWithBackoffAndCaches() {
        AtomicInteger invocations = new AtomicInteger();
        Operation<String> fetchUser = Operation.of(() -> {
            if (invocations.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "alice";
        });

        CompletableFuture<String> first = orchestrator.execute("user:1", fetchUser);
        assertThat(first).isNotDone();

        clock.advanceMillis(100);
        assertThat(invocations.get()).isEqualTo(2);
        clock.advanceMillis(200);

        assertThat(first).isCompletedWithValue("alice");
        assertThat(invocations.get()).isEqualTo(3);
        assertThat(clock.requestedDelays()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(reported).hasSize(2);

        clock.advanceMillis(500);
        CompletableFuture<String> second = orchestrator.execute("user:1", fetchUser);

        assertThat(second).isCompletedWithValue("alice");
        assertThat(invocations.get()).isEqualTo(3);
    }

    @Test
    void execute_singleSlotAndManyInlineKeys_completesEveryCall() {
        Orchestrator serial = Orchestrator.builder()
                .config(OrchestratorConfig.builder().maxConcurrency(1).build())
                .clock(clock)
                .build();
        CompletableFuture<String> gate = new CompletableFuture<>();
        serial.execute("gate", () -> gate);
        List<CompletableFuture<String>> calls = new ArrayList<>();
        for (int i = 0; i < 5_000; i++) {
            String key = "item:" + i;
            calls.add(serial.execute(key, Operation.of(() -> key)));
        }

        gate.complete("open");

        assertThat(calls).allMatch(call -> call.isDone() && !call.isCompletedExceptionally());
        assertThat(calls.get(4_999)).isCompletedWithValue("item:4999");
        assertThat(serial.limiter().activeCount()).isZero();
        assertThat(serial.limiter().queuedCount()).isZero();
    }

    @Test
    void execute_concurrentSameKey_invokesOperationOnce() {
        AtomicInteger invocations = new AtomicInteger();
        CompletableFuture<String> response = new CompletableFuture<>();
        Operation<String> slow = () -> {
            invocations.incrementAndGet();
            return response;
        };

        List<CompletableFuture<String>> callers = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            callers.add(orchestrator.execute("user:1", slow));
        }
        response.complete("alice");

        assertThat(invocations.get()).isEqualTo(1);
        assertThat(callers).allSatisfy(caller -> assertThat(caller).isCompletedWithValue("alice"));
    }

    @Test
    void execute_moreKeysThanSlots_queuesTheRest() {
        List<CompletableFuture<String>> responses = new ArrayList<>();
        List<CompletableFuture<String>> results = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            CompletableFuture<String> response = new CompletableFuture<>();
            responses.add(response);
            results.add(orchestrator.execute("item:" + i, () -> response));
        }

        assertThat(orchestrator.limiter().activeCount()).isEqualTo(2);
        assertThat(orchestrator.limiter().queuedCount()).isEqualTo(2);

        responses.forEach(response -> response.complete("ok"));

        assertThat(results).allSatisfy(result -> assertThat(result).isCompletedWithValue("ok"));
        assertThat(orchestrator.limiter().activeCount()).isZero();
    }

    @Test
    void execute_retriesExhausted_raisesTerminalErrorWithAttemptCount() {
        IOException last = new IOException("still down");

        CompletableFuture<String> result = orchestrator.execute("user:1", Operation.of(() -> {
            throw last;
        }));
        clock.advanceMillis(1000);

        Throwable error = result.handle((v, e) -> e).join();
        assertThat(error).isInstanceOf(RetriesExhaustedException.class).hasCause(last);
        assertThat(((RetriesExhaustedException) error).attempts()).isEqualTo(3);
        assertThat(orchestrator.cache().size()).isZero();
        assertThat(orchestrator.limiter().activeCount()).isZero();
    }

    @Test
    void execute_permanentFailure_propagatesUnchangedAfterOneAttempt() {
        AtomicInteger invocations = new AtomicInteger();
        HttpStatusException notFound = new HttpStatusException(404, "Not Found");

        CompletableFuture<String> result = orchestrator.execute("user:404", Operation.of(() -> {
            invocations.incrementAndGet();
            throw notFound;
        }));

        assertThat(result.handle((v, e) -> e).join()).isSameAs(notFound);
        assertThat(invocations.get()).isEqualTo(1);
        assertThat(clock.pendingTimers()).isZero();
    }

    @Test
    void execute_expiredEntry_servesStaleAndRefreshesInBackground() {
        AtomicInteger version = new AtomicInteger();
        Operation<Integer> fetch = Operation.of(version::incrementAndGet);
        orchestrator.execute("config", fetch).join();
        clock.advanceMillis(1000);

        CompletableFuture<Integer> stale = orchestrator.execute("config", fetch);

        assertThat(stale).isCompletedWithValue(1);
        assertThat(version.get()).isEqualTo(2);
        assertThat(orchestrator.execute("config", fetch)).isCompletedWithValue(2);
    }

    @Test
    void execute_callOptions_overrideTtlAndRetry() {
        AtomicInteger invocations = new AtomicInteger();
        Operation<String> flaky = Operation.of(() -> {
            invocations.incrementAndGet();
            throw new IOException("x");
        });
        CallOptions options = CallOptions.builder()
                .ttl(Duration.ofSeconds(30))
                .retry(RetryConfig.builder().maxAttempts(1).build())
                .build();

        CompletableFuture<String> result = orchestrator.execute("k", flaky, options);

        assertThat(invocations.get()).isEqualTo(1);
        assertThat(result.handle((v, e) -> e).join()).isInstanceOf(RetriesExhaustedException.class);

        orchestrator.execute("long-lived", Operation.of(() -> "v"), CallOptions.ttl(Duration.ofSeconds(30))).join();
        clock.advanceMillis(10_000);
        assertThat(orchestrator.cache().<String>peek("long-lived")).contains("v");
        assertThat(orchestrator.cache().isRefreshing("long-lived")).isFalse();
    }

    @Test
    void execute_attemptTimeout_countsAsTransientFailure() {
        AtomicInteger invocations = new AtomicInteger();
        Operation<String> hanging = () -> {
            invocations.incrementAndGet();
            return new CompletableFuture<>();
        };
        CallOptions options = CallOptions.retry(RetryConfig.builder()
                .maxAttempts(2)
                .attemptTimeout(Duration.ofMillis(50))
                .build());

        CompletableFuture<String> result = orchestrator.execute("slow", hanging, options);
        clock.advanceMillis(50);
        clock.advanceMillis(100);
        assertThat(invocations.get()).isEqualTo(2);
        clock.advanceMillis(50);

        Throwable error = result.handle((v, e) -> e).join();
        assertThat(error).isInstanceOf(RetriesExhaustedException.class);
        assertThat(error.getCause()).isInstanceOf(TimeoutFailureException.class);
    }

    @Test
    void execute_callerCancels_cancelsUnderlyingCallAndFreesSlot() {
        CompletableFuture<String> response = new CompletableFuture<>();

        CompletableFuture<String> result = orchestrator.execute("user:1", () -> response);
        result.cancel(true);

        assertThat(response).isCancelled();
        assertThat(orchestrator.limiter().activeCount()).isZero();
        assertThat(orchestrator.deduplicator().pendingCount()).isZero();
    }

    @Test
    void invalidate_forcesNextCallToFetch() {
        AtomicInteger invocations = new AtomicInteger();
        Operation<Integer> fetch = Operation.of(invocations::incrementAndGet);
        orchestrator.execute("k", fetch).join();

        assertThat(orchestrator.invalidate("k")).isTrue();

        assertThat(orchestrator.execute("k", fetch).join()).isEqualTo(2);
    }

    @Test
    void builder_invalidConfig_failsFast() {
        assertThatThrownBy(() -> OrchestratorConfig.builder().maxConcurrency(0).build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void builder_defaults_useConfigDefaults() {
        Orchestrator defaults = Orchestrator.builder().clock(clock).reporter(OpReporter.noOp()).build();

        assertThat(defaults.config().ttl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(defaults.limiter().maxConcurrency()).isEqualTo(OrchestratorConfig.DEFAULT_MAX_CONCURRENCY);
        assertThat(defaults.cache().capacity()).isZero();
    }
}
