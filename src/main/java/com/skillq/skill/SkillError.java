package com.skillq.skill;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.skillq.error.SkillQException;

import java.util.Map;

public record SkillError(String message, String code, Map<String, Object> details, @JsonIgnore boolean retryable) {

    public SkillError {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * Known pipeline errors keep their code and retry flag; anything else is a retryable
     * {@code EXECUTION_ERROR}.
     */
    public static SkillError from(Throwable error) {
        if (error instanceof SkillQException known) {
            return new SkillError(known.getMessage(), known.getCode(), known.getDetails(), known.isRetryable());
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new SkillError(message, SkillQException.EXECUTION_ERROR, Map.of(), true);
    }
}
