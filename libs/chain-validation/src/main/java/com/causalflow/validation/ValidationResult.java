package com.causalflow.validation;

import java.util.List;

/**
 * Result of validating a chain's structural, temporal and ordering integrity.
 *
 * <p>Errors mean the chain is inconsistent and make it invalid. Warnings flag unusual but
 * consistent chains and never affect {@link #valid()}.
 *
 * @param valid    true when {@code errors} is empty
 * @param errors   human-readable hard errors (empty when valid)
 * @param warnings human-readable soft findings
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /** Builds a result whose validity follows from the error list. */
    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }
}
