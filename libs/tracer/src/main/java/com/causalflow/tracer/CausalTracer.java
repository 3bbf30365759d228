package com.causalflow.tracer;

import com.causalflow.tracemodel.Layer;
import com.causalflow.tracemodel.TraceChain;
import com.causalflow.tracemodel.TraceNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Records causal trees of spans as a logical operation moves through the six {@link Layer}s.
 * <p>
 * A span is opened with {@code start}, optionally annotated with {@link #record}, and sealed with
 * {@link #finish}. When no parent is given, the flow's current trace id (see
 * {@link TraceContextHolder}) becomes the parent, and the new span becomes current; finishing
 * restores its parent. Spans therefore nest in LIFO order without ids being passed around.
 * Finishing out of LIFO order leaves the current id pointing at the wrong span.
 * <p>
 * A span without a parent roots a new {@link TraceChain}; any other span is appended to its
 * parent's chain as soon as it starts. Stored chains are capped at
 * {@link TracerProperties#maxChains()}: after each new root the oldest chains without active spans
 * are evicted first, then the oldest chains regardless. Spans whose chain was evicted stay active
 * but are stored nowhere. Unfinished spans older than {@link TracerProperties#activeSpanTtl()} are
 * swept out of the active table.
 * <p>
 * Tracing never breaks the instrumented code: {@code start}, {@code record} and {@code finish}
 * catch every {@link RuntimeException} raised inside them, log it, count it and answer with
 * {@link #NO_TRACE} or a no-op.
 * <p>
 * All store state is guarded by a read-write lock, so one instance can be shared by every thread
 * of an application. Construct one at the composition root; {@link GlobalTracer} is an optional
 * static accessor on top.
 */
public final class CausalTracer {

    /** Id returned when no span was created. record and finish ignore it. */
    public static final String NO_TRACE = "";

    private static final Logger log = LoggerFactory.getLogger(CausalTracer.class);

    private final TracerProperties properties;
    private final Clock clock;
    private final TracerMetrics metrics;
    private final TraceContextHolder context = new TraceContextHolder();
    private final AtomicBoolean enabled;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Stored chains keyed by root id, in creation order. */
    private final Map<String, TraceChain> chains = new LinkedHashMap<>();
    /** Node id to root id, for every node held in a stored chain. */
    private final Map<String, String> owners = new HashMap<>();
    /** Started but unfinished spans, latest version of each node. */
    private final Map<String, TraceNode> active = new HashMap<>();

    /**
     * Creates a tracer with default settings, a private meter registry and the UTC system clock.
     */
    public CausalTracer() {
        this(TracerProperties.defaults());
    }

    /**
     * Creates a tracer with a private meter registry and the UTC system clock.
     */
    public CausalTracer(TracerProperties properties) {
        this(properties, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    /**
     * Creates a tracer.
     *
     * @param properties tracer settings
     * @param registry   registry receiving the tracer's meters
     * @param clock      source of node timestamps
     */
    public CausalTracer(TracerProperties properties, MeterRegistry registry, Clock clock) {
        if (properties == null) {
            throw new IllegalArgumentException("properties must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.properties = properties;
        this.clock = clock;
        this.metrics = new TracerMetrics(registry, properties.serviceName());
        this.enabled = new AtomicBoolean(properties.enabled());
        metrics.gauge(TracerMetrics.CHAINS_STORED, "Chains currently stored", this, CausalTracer::getChainCount);
        metrics.gauge(TracerMetrics.SPANS_ACTIVE, "Spans started and not finished", this,
                CausalTracer::getActiveSpanCount);
    }

    // ---- Toggle ----

    public void enable() {
        if (!enabled.getAndSet(true)) {
            log.info("Causal tracing enabled");
        }
    }

    /**
     * Stops new spans from being created. Spans already open can still record and finish.
     */
    public void disable() {
        if (enabled.getAndSet(false)) {
            log.info("Causal tracing disabled");
        }
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    // ---- Span lifecycle ----

    public String start(Layer layer, String module, String action) {
        return start(layer, module, action, null, null);
    }

    public String start(Layer layer, String module, String action, Map<String, Object> data) {
        return start(layer, module, action, data, null);
    }

    /**
     * Opens a span.
     *
     * @param layer    layer the event belongs to
     * @param module   free-text module label
     * @param action   free-text action label
     * @param data     initial data, may be {@code null}
     * @param parentId explicit parent; {@code null} uses the current trace id
     * @return the new span id, or {@link #NO_TRACE} when disabled or on a tracing fault
     */
    public String start(Layer layer, String module, String action, Map<String, Object> data, String parentId) {
        if (!enabled.get()) {
            return NO_TRACE;
        }
        return failOpen("start", () -> doStart(layer, module, action, data, parentId), NO_TRACE);
    }

    public String start(String layer, String module, String action) {
        return start(layer, module, action, null, null);
    }

    public String start(String layer, String module, String action, Map<String, Object> data) {
        return start(layer, module, action, data, null);
    }

    /**
     * Opens a span, parsing the layer from its code or name ("L2", "memory").
     * An unknown layer is a tracing fault and yields {@link #NO_TRACE}.
     */
    public String start(String layer, String module, String action, Map<String, Object> data, String parentId) {
        if (!enabled.get()) {
            return NO_TRACE;
        }
        return failOpen("start", () -> {
            Layer parsed = Layer.parse(layer).orElseThrow(() ->
                    new TracingFault(TracingFault.Kind.INVALID_LAYER, "Invalid layer: " + layer));
            return doStart(parsed, module, action, data, parentId);
        }, NO_TRACE);
    }

    /**
     * Merges one entry into an active span's data. Ignored when disabled, for {@link #NO_TRACE},
     * and for ids that are not active.
     */
    public void record(String traceId, String key, Object value) {
        if (!enabled.get() || isNoTrace(traceId)) {
            return;
        }
        failOpen("record", () -> {
            if (TraceNode.isReservedKey(key)) {
                throw new TracingFault(TracingFault.Kind.RESERVED_KEY, "Key is written only by finish: " + key);
            }
            lock.writeLock().lock();
            try {
                TraceNode node = requireActive(traceId);
                TraceNode updated = node.withData(key, value);
                active.put(traceId, updated);
                storedChainOf(traceId).ifPresent(chain -> chain.replace(updated));
            } finally {
                lock.writeLock().unlock();
            }
            return null;
        }, null);
    }

    public void finish(String traceId) {
        finish(traceId, null);
    }

    /**
     * Seals a span: writes {@code result} (when non-null) and {@code finished_at}, removes it from
     * the active table, and makes its parent the current trace id again. Works while disabled, so
     * spans opened before {@link #disable()} can still close.
     */
    public void finish(String traceId, Object result) {
        if (isNoTrace(traceId)) {
            return;
        }
        failOpen("finish", () -> {
            TraceNode sealed;
            lock.writeLock().lock();
            try {
                TraceNode node = requireActive(traceId);
                sealed = node.sealed(result, clock.instant());
                active.remove(traceId);
                storedChainOf(traceId).ifPresent(chain -> chain.replace(sealed));
            } finally {
                lock.writeLock().unlock();
            }
            context.set(sealed.parentId());
            metrics.spanFinished();
            return null;
        }, null);
    }

    /**
     * Runs {@code work} inside a span and finishes it with the returned value as result, or with
     * {@code "error: <message>"} if the work throws. The work's exception is rethrown.
     */
    public <T> T inSpan(Layer layer, String module, String action, Callable<T> work) throws Exception {
        String traceId = start(layer, module, action);
        T result;
        try {
            result = work.call();
        } catch (Exception e) {
            finish(traceId, "error: " + e.getMessage());
            throw e;
        }
        finish(traceId, result);
        return result;
    }

    /**
     * Runnable variant of {@link #inSpan(Layer, String, String, Callable)}; the span has no result.
     */
    public void inSpan(Layer layer, String module, String action, Runnable work) {
        String traceId = start(layer, module, action);
        try {
            work.run();
        } catch (RuntimeException e) {
            finish(traceId, "error: " + e.getMessage());
            throw e;
        }
        finish(traceId);
    }

    // ---- Queries ----

    /**
     * Returns the chain that {@code traceId} belongs to. Any id of a stored node works, as does the
     * id of an active span whose ancestors reach a stored chain.
     */
    public Optional<TraceChain> getChain(String traceId) {
        if (isNoTrace(traceId)) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return resolveChain(traceId);
        } catch (RuntimeException e) {
            log.warn("Chain lookup failed for {}", traceId, e);
            metrics.fault(TracingFault.Kind.INTERNAL);
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Stored chains in creation order. */
    public List<TraceChain> getAllChains() {
        lock.readLock().lock();
        try {
            return List.copyOf(chains.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getChainCount() {
        lock.readLock().lock();
        try {
            return chains.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getActiveSpanCount() {
        lock.readLock().lock();
        try {
            return active.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of active spans started more than {@code age} ago. */
    public int getStaleSpanCount(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        lock.readLock().lock();
        try {
            int stale = 0;
            for (TraceNode node : active.values()) {
                if (node.timestamp().isBefore(cutoff)) {
                    stale++;
                }
            }
            return stale;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every stored chain. Active spans stay active and can still be finished.
     *
     * @return the number of chains dropped
     */
    public int clearChains() {
        lock.writeLock().lock();
        try {
            int cleared = chains.size();
            chains.clear();
            owners.clear();
            log.info("Cleared {} stored chains", cleared);
            return cleared;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes active spans older than the configured TTL. Their nodes stay in their chains,
     * unsealed.
     *
     * @return the number of spans removed
     */
    public int sweepExpiredSpans() {
        return failOpen("sweep", () -> {
            lock.writeLock().lock();
            try {
                return sweepLocked();
            } finally {
                lock.writeLock().unlock();
            }
        }, 0);
    }

    // ---- Ambient context ----

    /** Sets the current flow's trace id; {@code null} clears it. */
    public void setCurrentTrace(String traceId) {
        context.set(traceId);
    }

    public Optional<String> getCurrentTrace() {
        return context.get();
    }

    /** The ambient context holder, for wrapping tasks handed to executors. */
    public TraceContextHolder context() {
        return context;
    }

    public TracerProperties properties() {
        return properties;
    }

    public TracerMetrics metrics() {
        return metrics;
    }

    // ---- Internals ----

    private String doStart(Layer layer, String module, String action, Map<String, Object> data,
                           String explicitParent) {
        if (layer == null) {
            throw new TracingFault(TracingFault.Kind.INVALID_LAYER, "Layer must not be null");
        }
        if (data != null) {
            for (String key : data.keySet()) {
                if (TraceNode.isReservedKey(key)) {
                    throw new TracingFault(TracingFault.Kind.RESERVED_KEY, "Key is written only by finish: " + key);
                }
            }
        }
        String parentId = explicitParent != null ? explicitParent : context.get().orElse(null);
        if (isNoTrace(parentId)) {
            parentId = null;
        }
        Instant now = clock.instant();
        String id = UUID.randomUUID().toString();

        lock.writeLock().lock();
        try {
            TraceNode parent = parentId == null ? null : findNode(parentId);
            // Never let a child predate its parent, even if the clock steps back.
            Instant timestamp = parent != null && parent.timestamp().isAfter(now) ? parent.timestamp() : now;
            TraceNode node = new TraceNode(id, parentId, layer, module, action, data, timestamp);
            active.put(id, node);

            if (parentId == null) {
                chains.put(id, TraceChain.rootedAt(node));
                owners.put(id, id);
                evictLocked();
                if (properties.sweepEnabled()) {
                    sweepLocked();
                }
            } else {
                Optional<TraceChain> chain = resolveChain(parentId);
                if (chain.isPresent()) {
                    chain.get().attach(node);
                    owners.put(id, chain.get().rootId());
                } else {
                    log.warn("No stored chain for parent {}; span {} ({}/{}) is tracked but not stored",
                            parentId, id, module, action);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        context.set(id);
        metrics.spanStarted();
        return id;
    }

    /**
     * Resolves the chain owning {@code traceId}: first among stored nodes, then by walking the
     * active span's parents until one is stored or a root is reached. Caller holds a lock.
     */
    private Optional<TraceChain> resolveChain(String traceId) {
        Optional<TraceChain> stored = storedChainOf(traceId);
        if (stored.isPresent()) {
            return stored;
        }
        Set<String> visited = new HashSet<>();
        String current = traceId;
        for (int depth = 0; depth < properties.maxWalkDepth(); depth++) {
            if (!visited.add(current)) {
                return cycleDetected(traceId);
            }
            TraceNode node = active.get(current);
            if (node == null) {
                return Optional.empty();
            }
            if (node.parentId() == null) {
                return Optional.ofNullable(chains.get(node.id()));
            }
            stored = storedChainOf(node.parentId());
            if (stored.isPresent()) {
                return stored;
            }
            current = node.parentId();
        }
        return cycleDetected(traceId);
    }

    private Optional<TraceChain> cycleDetected(String traceId) {
        log.warn("Parent walk from {} revisited a node or exceeded {} steps", traceId, properties.maxWalkDepth());
        metrics.fault(TracingFault.Kind.CYCLE_DETECTED);
        return Optional.empty();
    }

    private Optional<TraceChain> storedChainOf(String nodeId) {
        String rootId = owners.get(nodeId);
        return rootId == null ? Optional.empty() : Optional.ofNullable(chains.get(rootId));
    }

    private TraceNode findNode(String id) {
        TraceNode node = active.get(id);
        if (node != null) {
            return node;
        }
        return storedChainOf(id).flatMap(chain -> chain.getNode(id)).orElse(null);
    }

    private TraceNode requireActive(String traceId) {
        TraceNode node = active.get(traceId);
        if (node == null) {
            throw new TracingFault(TracingFault.Kind.UNKNOWN_TRACE, "No active span: " + traceId);
        }
        return node;
    }

    private void evictLocked() {
        int excess = chains.size() - properties.maxChains();
        if (excess <= 0) {
            return;
        }
        Set<String> busyRoots = new HashSet<>();
        for (String activeId : active.keySet()) {
            String rootId = owners.get(activeId);
            if (rootId != null) {
                busyRoots.add(rootId);
            }
        }
        // Stable sort: chains created at the same instant keep creation order.
        List<TraceChain> byAge = new ArrayList<>(chains.values());
        byAge.sort(Comparator.comparing(TraceChain::createdAt));

        List<TraceChain> victims = new ArrayList<>();
        for (TraceChain chain : byAge) {
            if (victims.size() == excess) {
                break;
            }
            if (!busyRoots.contains(chain.rootId())) {
                victims.add(chain);
            }
        }
        for (TraceChain chain : byAge) {
            if (victims.size() == excess) {
                break;
            }
            if (!victims.contains(chain)) {
                victims.add(chain);
            }
        }

        for (TraceChain chain : victims) {
            chains.remove(chain.rootId());
            int orphaned = 0;
            for (TraceNode node : chain.nodes()) {
                owners.remove(node.id());
                if (active.containsKey(node.id())) {
                    orphaned++;
                }
            }
            if (orphaned > 0) {
                log.warn("Evicted chain {} with {} active spans; they will not be stored", chain.rootId(), orphaned);
            } else {
                log.debug("Evicted chain {} ({} nodes, created {})", chain.rootId(), chain.size(), chain.createdAt());
            }
        }
        metrics.chainsEvicted(victims.size());
    }

    private int sweepLocked() {
        if (!properties.sweepEnabled()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(properties.activeSpanTtl());
        int expired = 0;
        Iterator<TraceNode> it = active.values().iterator();
        while (it.hasNext()) {
            TraceNode node = it.next();
            if (node.timestamp().isBefore(cutoff)) {
                it.remove();
                expired++;
                log.warn("Span {} ({}/{}) still open after {}; dropped from the active table",
                        node.id(), node.module(), node.action(), properties.activeSpanTtl());
            }
        }
        if (expired > 0) {
            metrics.spansExpired(expired);
        }
        return expired;
    }

    private <T> T failOpen(String operation, Supplier<T> body, T fallback) {
        try {
            return body.get();
        } catch (TracingFault fault) {
            if (fault.kind() == TracingFault.Kind.UNKNOWN_TRACE) {
                log.debug("Tracing fault in {}: {}", operation, fault.getMessage());
            } else {
                log.warn("Tracing fault in {}: {}", operation, fault.getMessage());
            }
            metrics.fault(fault.kind());
            return fallback;
        } catch (RuntimeException e) {
            log.warn("Tracing fault in {}", operation, e);
            metrics.fault(TracingFault.Kind.INTERNAL);
            return fallback;
        }
    }

    private static boolean isNoTrace(String traceId) {
        return traceId == null || traceId.isEmpty();
    }
}
