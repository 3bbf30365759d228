package com.causalflow.tracer;

import java.time.Duration;

/**
 * Tracer settings.
 *
 * <p>The compact constructor fills in defaults for missing or out-of-range values, so
 * {@code new TracerProperties(true, 0, null, 0, null)} is the same as {@link #defaults()}.
 *
 * @param enabled       whether tracing starts enabled
 * @param maxChains     cap on stored chains; the oldest are evicted beyond it (default 1000)
 * @param activeSpanTtl age after which an unfinished span is swept from the active table
 *                      (default 10 minutes, {@link Duration#ZERO} disables the sweep)
 * @param maxWalkDepth  bound on parent walks during chain resolution (default 1024)
 * @param serviceName   value of the {@code service} tag on tracer metrics (default "causalflow")
 */
public record TracerProperties(
        boolean enabled,
        int maxChains,
        Duration activeSpanTtl,
        int maxWalkDepth,
        String serviceName) {

    public static final int DEFAULT_MAX_CHAINS = 1000;
    public static final Duration DEFAULT_ACTIVE_SPAN_TTL = Duration.ofMinutes(10);
    public static final int DEFAULT_MAX_WALK_DEPTH = 1024;
    public static final String DEFAULT_SERVICE_NAME = "causalflow";

    public TracerProperties {
        if (maxChains <= 0) {
            maxChains = DEFAULT_MAX_CHAINS;
        }
        if (activeSpanTtl == null || activeSpanTtl.isNegative()) {
            activeSpanTtl = DEFAULT_ACTIVE_SPAN_TTL;
        }
        if (maxWalkDepth <= 0) {
            maxWalkDepth = DEFAULT_MAX_WALK_DEPTH;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
    }

    /** Enabled tracer with every default. */
    public static TracerProperties defaults() {
        return new TracerProperties(true, DEFAULT_MAX_CHAINS, DEFAULT_ACTIVE_SPAN_TTL,
                DEFAULT_MAX_WALK_DEPTH, DEFAULT_SERVICE_NAME);
    }

    /** Copy with a different chain cap. */
    public TracerProperties withMaxChains(int maxChains) {
        return new TracerProperties(enabled, maxChains, activeSpanTtl, maxWalkDepth, serviceName);
    }

    /** Copy with a different active-span TTL. */
    public TracerProperties withActiveSpanTtl(Duration activeSpanTtl) {
        return new TracerProperties(enabled, maxChains, activeSpanTtl, maxWalkDepth, serviceName);
    }

    /** True when the active-span sweep is switched on. */
    public boolean sweepEnabled() {
        return !activeSpanTtl.isZero();
    }
}
