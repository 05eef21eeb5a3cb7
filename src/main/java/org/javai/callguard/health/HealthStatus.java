package org.javai.callguard.health;

/**
 * The verdict for one check, or for a whole report.
 */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY
}
