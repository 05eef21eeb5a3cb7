package org.javai.callguard.health;

import org.javai.callguard.ConfigurationException;
import org.javai.callguard.Futures;
import org.javai.callguard.TimeoutFailureException;
import org.javai.callguard.time.Clock;
import org.javai.callguard.time.Timeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs named health checks concurrently, each against its own timeout, and reduces them into
 * one {@link HealthReport}.
 *
 * <p>{@link #runAll()} never completes exceptionally. A check that throws, fails or times out
 * becomes an unhealthy entry; the other checks still run and are reported.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * HealthAggregator health = new HealthAggregator(Clock.system());
 * health.register("database", () -> db.ping(), Duration.ofSeconds(2));
 * health.register("payments", () -> payments.status(), Duration.ofSeconds(1));
 *
 * HealthReport report = health.runAll().join();
 * }</pre>
 */
public final class HealthAggregator {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Registration> checks = new LinkedHashMap<>();

    public HealthAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Registers a check.
     *
     * @param name unique name for this aggregator
     * @param check the probe
     * @param timeout how long the probe may take before it counts as unhealthy
     * @throws ConfigurationException if the name is blank or already registered, or the timeout
     *         is not positive
     */
    public void register(String name, HealthCheck check, Duration timeout) {
        Objects.requireNonNull(check, "check must not be null");
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("health check name must not be blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("timeout for health check '" + name + "' must be positive, was: " + timeout);
        }
        lock.lock();
        try {
            if (checks.containsKey(name)) {
                throw new ConfigurationException("health check '" + name + "' is already registered");
            }
            checks.put(name, new Registration(name, check, timeout));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if a check with that name was registered
     */
    public boolean unregister(String name) {
        lock.lock();
        try {
            return checks.remove(name) != null;
        } finally {
            lock.unlock();
        }
    }

    public List<String> names() {
        lock.lock();
        try {
            return List.copyOf(checks.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs every registered check.
     *
     * @return a future with exactly one entry per check registered when the run started
     */
    public CompletableFuture<HealthReport> runAll() {
        List<Registration> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(checks.values());
        } finally {
            lock.unlock();
        }

        List<CompletableFuture<HealthEntry>> running = new ArrayList<>(snapshot.size());
        for (Registration registration : snapshot) {
            running.add(run(registration));
        }
        return CompletableFuture.allOf(running.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<HealthEntry> entries = new ArrayList<>(running.size());
                    for (CompletableFuture<HealthEntry> entry : running) {
                        entries.add(entry.join());
                    }
                    HealthReport report = HealthReport.of(entries, clock.now());
                    log.debug("Health report: {} ({} checks)", report.status(), entries.size());
                    return report;
                });
    }

    private CompletableFuture<HealthEntry> run(Registration registration) {
        Instant startedAt = clock.now();
        CompletableFuture<String> probe;
        try {
            probe = registration.check.probe();
            if (probe == null) {
                probe = CompletableFuture.failedFuture(new NullPointerException("probe returned no future"));
            }
        } catch (RuntimeException e) {
            probe = CompletableFuture.failedFuture(e);
        }

        return Timeouts.within(clock, probe, registration.timeout, registration.name)
                .handle((detail, error) -> {
                    Instant settledAt = clock.now();
                    Duration elapsed = Duration.between(startedAt, settledAt);
                    if (error == null) {
                        return HealthEntry.healthy(registration.name, detail, settledAt, elapsed);
                    }
                    String description = describe(Futures.unwrap(error));
                    log.warn("Health check [{}] unhealthy: {}", registration.name, description);
                    return HealthEntry.unhealthy(registration.name, description, settledAt, elapsed);
                });
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutFailureException timeout) {
            return "timed out after " + timeout.timeout().toMillis() + "ms";
        }
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }

    private record Registration(String name, HealthCheck check, Duration timeout) {}
}
