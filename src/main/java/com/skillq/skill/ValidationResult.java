package com.skillq.skill;

import java.util.List;

public record ValidationResult(boolean valid, List<ValidationIssue> errors) {

    private static final ValidationResult VALID = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult of(List<ValidationIssue> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(false, errors);
    }
}
