package org.javai.callguard.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry per registered check, in registration order, plus the overall verdict.
 * The overall status is healthy iff every entry is healthy.
 *
 * @param status the overall status
 * @param entries entries keyed by check name
 * @param timestamp when the report was assembled
 */
public record HealthReport(HealthStatus status, Map<String, HealthEntry> entries, Instant timestamp) {

    public HealthReport {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Builds a report whose overall status is derived from the entries.
     */
    public static HealthReport of(List<HealthEntry> entries, Instant timestamp) {
        Map<String, HealthEntry> byName = new LinkedHashMap<>();
        boolean healthy = true;
        for (HealthEntry entry : entries) {
            byName.put(entry.name(), entry);
            healthy &= entry.isHealthy();
        }
        return new HealthReport(healthy ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY, byName, timestamp);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    public Optional<HealthEntry> entry(String name) {
        return Optional.ofNullable(entries.get(name));
    }
}
