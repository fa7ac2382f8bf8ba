package com.skillq.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every error the pipeline knows how to classify.
 * <p>
 * The {@code code} is what users see, the {@code retryable} flag decides whether a failed job is
 * requeued with backoff or failed for good.
 */
public class SkillQException extends RuntimeException {

    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";

    private final String code;
    private final int statusCode;
    private final boolean retryable;
    private final Map<String, Object> details;

    public SkillQException(String message, String code, int statusCode, boolean retryable,
            Map<String, Object> details) {
        this(message, code, statusCode, retryable, details, null);
    }

    public SkillQException(String message, String code, int statusCode, boolean retryable,
            Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = statusCode;
        this.retryable = retryable;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getCode() {
        return code;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
