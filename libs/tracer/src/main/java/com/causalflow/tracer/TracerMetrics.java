package com.causalflow.tracer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.function.ToDoubleFunction;

/**
 * Micrometer meters for one tracer, all tagged with {@code service=<serviceName>}.
 * <p>
 * Counters: {@value #SPANS_STARTED}, {@value #SPANS_FINISHED}, {@value #SPANS_EXPIRED},
 * {@value #CHAINS_EVICTED}, {@value #FAULTS} (tagged by fault {@code kind}).
 * Gauges are registered by the tracer itself through {@link #gauge}.
 */
public final class TracerMetrics {

    public static final String SPANS_STARTED = "causalflow.spans.started";
    public static final String SPANS_FINISHED = "causalflow.spans.finished";
    public static final String SPANS_EXPIRED = "causalflow.spans.expired";
    public static final String CHAINS_EVICTED = "causalflow.chains.evicted";
    public static final String FAULTS = "causalflow.tracer.faults";
    public static final String CHAINS_STORED = "causalflow.chains.stored";
    public static final String SPANS_ACTIVE = "causalflow.spans.active";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for fault kind. */
    public static final String TAG_KIND = "kind";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Counter spansStarted;
    private final Counter spansFinished;
    private final Counter spansExpired;
    private final Counter chainsEvicted;

    /**
     * Creates the tracer meters in {@code registry}.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName service tag value
     */
    public TracerMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.spansStarted = counter(SPANS_STARTED, "Spans started");
        this.spansFinished = counter(SPANS_FINISHED, "Spans finished");
        this.spansExpired = counter(SPANS_EXPIRED, "Unfinished spans swept after their TTL");
        this.chainsEvicted = counter(CHAINS_EVICTED, "Chains evicted to respect the chain cap");
    }

    void spanStarted() {
        spansStarted.increment();
    }

    void spanFinished() {
        spansFinished.increment();
    }

    void spansExpired(int count) {
        spansExpired.increment(count);
    }

    void chainsEvicted(int count) {
        chainsEvicted.increment(count);
    }

    void fault(TracingFault.Kind kind) {
        Counter.builder(FAULTS)
                .description("Tracing faults absorbed by the tracer")
                .tags(baseTags().and(TAG_KIND, kind.name()))
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge reading {@code value} from {@code target}.
     */
    <T> void gauge(String name, String description, T target, ToDoubleFunction<T> value) {
        Gauge.builder(name, target, value)
                .description(description)
                .tags(baseTags())
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags())
                .register(registry);
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
