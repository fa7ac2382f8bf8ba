package com.skillq.error;

import java.util.List;
import java.util.Map;

public class ValidationException extends SkillQException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, CODE, 400, false, Map.of());
    }

    public ValidationException(String message, String field) {
        super(message, CODE, 400, false, Map.of("field", field));
    }

    public ValidationException(String message, List<?> errors) {
        super(message, CODE, 400, false, Map.of("errors", List.copyOf(errors)));
    }
}
