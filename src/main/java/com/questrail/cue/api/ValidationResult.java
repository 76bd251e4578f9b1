package com.questrail.cue.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a validation-only parse.
 */
public record ValidationResult(boolean valid, Optional<String> error)
{
    private static final ValidationResult OK = new ValidationResult(true, Optional.empty());

    public ValidationResult {
        Objects.requireNonNull(error, "error");
        if (valid == error.isPresent()) {
            throw new IllegalArgumentException("a valid result carries no error, an invalid one must");
        }
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, Optional.of(error));
    }
}
