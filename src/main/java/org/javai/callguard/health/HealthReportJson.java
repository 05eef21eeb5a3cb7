package org.javai.callguard.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;

/**
 * Renders a {@link HealthReport} as JSON, for use as a liveness endpoint body.
 *
 * <pre>{@code
 * {"status":"UNHEALTHY","timestamp":"2024-01-20T10:30:00Z",
 *  "checks":{"database":{"status":"HEALTHY","detail":"ok","timestamp":"...","elapsedMs":12},
 *            "payments":{"status":"UNHEALTHY","detail":"timed out after 1000ms",...}}}
 * }</pre>
 */
public final class HealthReportJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HealthReportJson() {
        // Utility class
    }

    public static ObjectNode toNode(HealthReport report) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("status", report.status().name());
        root.put("timestamp", report.timestamp().toString());
        ObjectNode checks = root.putObject("checks");
        report.entries().forEach((name, entry) -> {
            ObjectNode check = checks.putObject(name);
            check.put("status", entry.status().name());
            check.put("detail", entry.detail());
            check.put("timestamp", entry.timestamp().toString());
            check.put("elapsedMs", entry.elapsed().toMillis());
        });
        return root;
    }

    public static String toJson(HealthReport report) {
        try {
            return MAPPER.writeValueAsString(toNode(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
