package com.causalflow.tracer.autoconfigure;

import com.causalflow.tracer.TracerProperties;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized tracer settings, bound from {@code causalflow.tracer.*}.
 *
 * <pre>
 * causalflow:
 *   tracer:
 *     enabled: true
 *     max-chains: 1000
 *     active-span-ttl: 10m
 *     max-walk-depth: 1024
 *     service-name: checkout
 *     install-global: true
 * </pre>
 *
 * <p>Unset values take the {@link TracerProperties} defaults. Explicit values that break a
 * constraint fail the context at startup.
 *
 * @param enabled       whether tracing starts enabled (default true)
 * @param maxChains     cap on stored chains
 * @param activeSpanTtl age after which unfinished spans are swept; {@code 0} disables the sweep,
 *                      negative values are rejected
 * @param maxWalkDepth  bound on parent walks during chain resolution
 * @param serviceName   {@code service} tag on tracer metrics
 * @param installGlobal whether the tracer bean is also installed in {@code GlobalTracer} (default true)
 */
@ConfigurationProperties(prefix = "causalflow.tracer")
@Validated
public record CausalTracerProperties(
        Boolean enabled,
        @Min(1) Integer maxChains,
        @DurationMin(seconds = 0) Duration activeSpanTtl,
        @Min(1) Integer maxWalkDepth,
        String serviceName,
        Boolean installGlobal) {

    /**
     * Compact constructor, fills in defaults for unbound values before Bean Validation runs.
     */
    public CausalTracerProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (maxChains == null) {
            maxChains = TracerProperties.DEFAULT_MAX_CHAINS;
        }
        if (activeSpanTtl == null) {
            activeSpanTtl = TracerProperties.DEFAULT_ACTIVE_SPAN_TTL;
        }
        if (maxWalkDepth == null) {
            maxWalkDepth = TracerProperties.DEFAULT_MAX_WALK_DEPTH;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = TracerProperties.DEFAULT_SERVICE_NAME;
        }
        if (installGlobal == null) {
            installGlobal = true;
        }
    }

    /** Converts to the framework-free settings the tracer takes. */
    public TracerProperties toTracerProperties() {
        return new TracerProperties(enabled, maxChains, activeSpanTtl, maxWalkDepth, serviceName);
    }
}
