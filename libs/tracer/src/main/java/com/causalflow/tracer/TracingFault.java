package com.causalflow.tracer;

/**
 * A problem inside the tracer itself.
 *
 * <p>Tracing faults never reach instrumented code: {@link CausalTracer} catches them at the
 * boundary of each public operation, logs and counts them, and answers with
 * {@link CausalTracer#NO_TRACE} or a no-op.
 */
public class TracingFault extends RuntimeException {

    /** Fault categories, also used as the {@code kind} metric tag. */
    public enum Kind {
        /** Layer text matched neither a code nor a layer name. */
        INVALID_LAYER,
        /** record or finish named an id that is not active. */
        UNKNOWN_TRACE,
        /** record tried to write a key that only finish may write. */
        RESERVED_KEY,
        /** A parent walk revisited a node or exceeded its depth bound. */
        CYCLE_DETECTED,
        /** Any other exception raised inside the tracer. */
        INTERNAL
    }

    private final Kind kind;

    public TracingFault(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TracingFault(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
