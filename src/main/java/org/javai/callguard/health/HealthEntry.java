package org.javai.callguard.health;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The result of one check in a {@link HealthReport}.
 *
 * @param name the registered check name
 * @param status healthy or unhealthy
 * @param detail the probe's detail, or the failure description
 * @param timestamp when the check settled
 * @param elapsed how long the check took
 */
public record HealthEntry(String name, HealthStatus status, String detail, Instant timestamp, Duration elapsed) {

    public HealthEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        detail = detail == null ? "" : detail;
    }

    public static HealthEntry healthy(String name, String detail, Instant timestamp, Duration elapsed) {
        return new HealthEntry(name, HealthStatus.HEALTHY, detail, timestamp, elapsed);
    }

    public static HealthEntry unhealthy(String name, String detail, Instant timestamp, Duration elapsed) {
        return new HealthEntry(name, HealthStatus.UNHEALTHY, detail, timestamp, elapsed);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
