package com.skillq.error;

import com.skillq.skill.ResourceUsage;

import java.util.Map;

/**
 * Transient failure inside a skill, such as a provider timeout. Retryable unless stated otherwise.
 * May carry the provider usage spent before the failure so it is still accounted on the job.
 */
public class SkillExecutionException extends SkillQException {

    private final ResourceUsage resourceUsage;

    public SkillExecutionException(String message) {
        this(message, EXECUTION_ERROR, true, Map.of(), null);
    }

    public SkillExecutionException(String message, Throwable cause) {
        this(message, EXECUTION_ERROR, true, Map.of(), cause);
    }

    public SkillExecutionException(String message, String code, boolean retryable, Map<String, Object> details,
            Throwable cause) {
        this(message, code, retryable, details, cause, null);
    }

    public SkillExecutionException(String message, String code, boolean retryable, Map<String, Object> details,
            Throwable cause, ResourceUsage resourceUsage) {
        super(message, code, 500, retryable, details, cause);
        this.resourceUsage = resourceUsage;
    }

    public ResourceUsage getResourceUsage() {
        return resourceUsage;
    }
}
