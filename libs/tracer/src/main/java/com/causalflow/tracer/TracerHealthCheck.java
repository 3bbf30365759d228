package com.causalflow.tracer;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Reports whether a {@link CausalTracer} is recording normally.
 * <p>
 * DEGRADED when tracing is disabled, or when active spans have been open for more than half of
 * the active-span TTL (they are about to be swept, which usually means a missing finish).
 */
public final class TracerHealthCheck {

    /** Component name used in results. */
    public static final String COMPONENT = "causal-tracer";

    private final CausalTracer tracer;

    public TracerHealthCheck(CausalTracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs the check. The future is already complete; it lets callers combine this check with
     * slower ones under a timeout.
     */
    public CompletableFuture<TracerHealth> check() {
        long start = System.currentTimeMillis();
        try {
            return CompletableFuture.completedFuture(evaluate(start));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(
                    result(TracerHealth.Status.UNHEALTHY, e.getMessage(), start));
        }
    }

    private TracerHealth evaluate(long start) {
        if (!tracer.isEnabled()) {
            return result(TracerHealth.Status.DEGRADED, "tracing disabled", start);
        }
        TracerProperties props = tracer.properties();
        if (props.sweepEnabled()) {
            Duration threshold = props.activeSpanTtl().dividedBy(2);
            int stale = tracer.getStaleSpanCount(threshold);
            if (stale > 0) {
                return result(TracerHealth.Status.DEGRADED,
                        stale + " active spans open longer than " + threshold, start);
            }
        }
        return result(TracerHealth.Status.HEALTHY, null, start);
    }

    private static TracerHealth result(TracerHealth.Status status, String detail, long start) {
        return new TracerHealth(COMPONENT, status, detail, System.currentTimeMillis() - start);
    }
}
