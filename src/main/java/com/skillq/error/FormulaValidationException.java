package com.skillq.error;

import java.util.Map;

/**
 * Raised when configured conversion rates or thresholds drift from the compiled constants.
 * Never retried: running with wrong formula inputs is a deployment problem.
 */
public class FormulaValidationException extends SkillQException {

    public static final String CODE = "FORMULA_VALIDATION_ERROR";

    public FormulaValidationException(String message, Map<String, Object> mismatches) {
        super(message, CODE, 500, false, mismatches);
    }
}
