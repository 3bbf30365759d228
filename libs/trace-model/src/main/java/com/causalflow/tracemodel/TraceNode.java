package com.causalflow.tracemodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One traced event in a {@link TraceChain}.
 *
 * <p>A node never changes after creation. Recording data or finishing a span produces a copy with
 * the same id, which the tracer swaps into the owning chain. The two keys {@link #RESULT_KEY} and
 * {@link #FINISHED_AT_KEY} are reserved for {@link #sealed(Object, Instant)}.
 *
 * @param id        unique opaque token assigned at creation
 * @param parentId  id of the parent node in the same chain, {@code null} only for a root
 * @param layer     layer the event is attributed to
 * @param module    free-text module label
 * @param action    free-text action label
 * @param data      open key/value data, insertion ordered (null values allowed)
 * @param timestamp creation instant
 */
public record TraceNode(
        String id,
        String parentId,
        Layer layer,
        String module,
        String action,
        Map<String, Object> data,
        Instant timestamp) {

    /** Reserved data key holding the value passed to finish. */
    public static final String RESULT_KEY = "result";

    /** Reserved data key holding the instant the span was finished. */
    public static final String FINISHED_AT_KEY = "finished_at";

    public TraceNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (layer == null) {
            throw new IllegalArgumentException("layer must not be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        data = data == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /** True if this node anchors its chain. */
    public boolean isRoot() {
        return parentId == null;
    }

    /** True once finish has written {@link #FINISHED_AT_KEY}. */
    public boolean isFinished() {
        return data.containsKey(FINISHED_AT_KEY);
    }

    /** Returns a copy with one data entry merged in. */
    public TraceNode withData(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(data);
        merged.put(key, value);
        return new TraceNode(id, parentId, layer, module, action, merged, timestamp);
    }

    /**
     * Returns a sealed copy carrying {@code result} (when non-null) and {@code finished_at}.
     */
    public TraceNode sealed(Object result, Instant finishedAt) {
        Map<String, Object> merged = new LinkedHashMap<>(data);
        if (result != null) {
            merged.put(RESULT_KEY, result);
        }
        merged.put(FINISHED_AT_KEY, finishedAt);
        return new TraceNode(id, parentId, layer, module, action, merged, timestamp);
    }

    /** True if {@code key} is written only by finish. */
    public static boolean isReservedKey(String key) {
        return RESULT_KEY.equals(key) || FINISHED_AT_KEY.equals(key);
    }
}
