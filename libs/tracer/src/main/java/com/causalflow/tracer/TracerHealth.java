package com.causalflow.tracer;

/**
 * Outcome of one {@link TracerHealthCheck} run.
 *
 * @param component name reported for the tracer
 * @param status    overall verdict
 * @param detail    why the tracer is not healthy; {@code null} when it is
 * @param latencyMs time the check took
 */
public record TracerHealth(String component, Status status, String detail, long latencyMs) {

    public enum Status {
        /** Recording normally. */
        HEALTHY,
        /** Disabled, or holding spans that are close to being swept. */
        DEGRADED,
        /** The check itself failed. */
        UNHEALTHY
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
