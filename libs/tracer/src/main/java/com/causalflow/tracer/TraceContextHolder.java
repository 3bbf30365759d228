package com.causalflow.tracer;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Ambient "current trace id" for each concurrently running flow, with an SLF4J MDC bridge.
 * <p>
 * Backed by an {@link InheritableThreadLocal}: a thread spawned from a traced thread starts with
 * a copy of its parent's id and can change it afterwards without affecting the parent. Two
 * unrelated flows on different threads therefore build disjoint trees without passing ids around.
 * <p>
 * Pooled executor threads are created once and inherit nothing useful, so work handed to a pool
 * should be wrapped with {@link #wrap(Runnable)} or {@link #wrap(Callable)}, which capture the
 * submitting thread's id and restore the worker's own afterwards.
 * <p>
 * While an id is set it is also published under the MDC key {@link #MDC_TRACE_NODE_ID} so log
 * lines written inside a span carry it.
 */
public final class TraceContextHolder {

    /** MDC key holding the current trace node id. */
    public static final String MDC_TRACE_NODE_ID = "traceNodeId";

    private final InheritableThreadLocal<String> current = new InheritableThreadLocal<>();

    /**
     * Returns the current flow's trace id, if set.
     */
    public Optional<String> get() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Sets the current flow's trace id; {@code null} or empty clears it.
     *
     * @param traceId the id to make current
     */
    public void set(String traceId) {
        if (traceId == null || traceId.isEmpty()) {
            clear();
            return;
        }
        current.set(traceId);
        MDC.put(MDC_TRACE_NODE_ID, traceId);
    }

    /**
     * Clears the current flow's trace id and its MDC key.
     */
    public void clear() {
        current.remove();
        MDC.remove(MDC_TRACE_NODE_ID);
    }

    /**
     * Runs {@code runnable} with {@code traceId} as the current id, then restores the previous id
     * (or clears if there was none).
     */
    public void runWithTrace(String traceId, Runnable runnable) {
        String previous = current.get();
        try {
            set(traceId);
            runnable.run();
        } finally {
            set(previous);
        }
    }

    /**
     * Captures the calling thread's trace id for a task that will run on another thread.
     *
     * @param task the task to wrap
     * @return a task that runs with the captured id current
     */
    public Runnable wrap(Runnable task) {
        String captured = current.get();
        return () -> runWithTrace(captured, task);
    }

    /**
     * Callable variant of {@link #wrap(Runnable)}.
     */
    public <T> Callable<T> wrap(Callable<T> task) {
        String captured = current.get();
        return () -> {
            String previous = current.get();
            try {
                set(captured);
                return task.call();
            } finally {
                set(previous);
            }
        };
    }
}
