package com.causalflow.tracer;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide access to one {@link CausalTracer}, for call sites that cannot have the tracer
 * injected. The application installs its composition-root instance at startup; if nothing was
 * installed, the first {@link #get()} installs a tracer with default settings.
 */
public final class GlobalTracer {

    private static final AtomicReference<CausalTracer> INSTANCE = new AtomicReference<>();

    private GlobalTracer() {
        // utility class
    }

    /**
     * Installs {@code tracer} as the process-wide instance, replacing any previous one.
     *
     * @throws IllegalArgumentException if tracer is null
     */
    public static void install(CausalTracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        INSTANCE.set(tracer);
    }

    /**
     * Returns the installed tracer, installing a default one on first use.
     */
    public static CausalTracer get() {
        CausalTracer tracer = INSTANCE.get();
        if (tracer != null) {
            return tracer;
        }
        INSTANCE.compareAndSet(null, new CausalTracer());
        return INSTANCE.get();
    }

    /** True if a tracer has been installed or lazily created. */
    public static boolean isInstalled() {
        return INSTANCE.get() != null;
    }

    /** Forgets the installed tracer. Intended for tests and shutdown. */
    public static void reset() {
        INSTANCE.set(null);
    }
}
