package com.causalflow.validation;

import java.util.List;

/**
 * Result of checking that a chain touches every required layer.
 *
 * @param valid  true if every required layer has at least one node
 * @param errors one message per missing layer
 */
public record CoverageResult(boolean valid, List<String> errors) {

    public CoverageResult {
        errors = List.copyOf(errors);
    }
}
