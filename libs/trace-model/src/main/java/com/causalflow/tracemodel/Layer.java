package com.causalflow.tracemodel;

import java.util.Locale;
import java.util.Optional;

/**
 * The six architectural layers a traced event can be attributed to.
 *
 * <p>Declaration order is the canonical rank order (L1 lowest, L6 highest). The tracer treats the
 * labels as opaque; only {@link #rank()} is used, when the validator checks for backward flow.
 */
public enum Layer {

    BIOLOGY("L1", "Biology"),
    MEMORY("L2", "Memory"),
    IDENTITY("L3", "Identity"),
    CREATION("L4", "Creation"),
    PRESENCE("L5", "Presence"),
    EXECUTION("L6", "Execution");

    private final String code;
    private final String displayName;

    Layer(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /** Short code used on the wire and in logs (e.g. "L3"). */
    public String code() {
        return code;
    }

    /** Human-readable layer name (e.g. "Identity"). */
    public String displayName() {
        return displayName;
    }

    /** Canonical rank, 1 for {@link #BIOLOGY} through 6 for {@link #EXECUTION}. */
    public int rank() {
        return ordinal() + 1;
    }

    /**
     * Parses a layer from either its constant name or its short code. Matching is
     * case-insensitive and ignores surrounding whitespace.
     *
     * @param value the text to parse (e.g. "L2", "memory", " MEMORY ")
     * @return the matching layer, or empty if nothing matches
     */
    public static Optional<Layer> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Layer layer : values()) {
            if (layer.code.equals(normalized) || layer.name().equals(normalized)) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }

    /**
     * Strict lookup by short code.
     *
     * @throws IllegalArgumentException if the code is not one of L1..L6
     */
    public static Layer fromCode(String code) {
        for (Layer layer : values()) {
            if (layer.code.equals(code)) {
                return layer;
            }
        }
        throw new IllegalArgumentException("Unknown layer code: " + code);
    }
}
