package com.skillq.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.skillq.Job;
import com.skillq.JobStatus;
import com.skillq.JobType;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Status view of a job. {@code result} is present once completed, {@code error} after a failed attempt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        UUID id,
        UUID subjectId,
        JobType jobType,
        JobStatus status,
        int priority,
        Progress progress,
        Timing timing,
        JsonNode result,
        ErrorInfo error,
        AiUsage aiUsage,
        RetryInfo retryInfo) {

    public static JobResponse from(Job job) {
        ErrorInfo error = job.getErrorCode() != null
                ? new ErrorInfo(job.getErrorCode(), job.getErrorMessage(), job.getErrorDetails())
                : null;
        return new JobResponse(
                job.getId(),
                job.getSubjectId(),
                job.getType(),
                job.getStatus(),
                job.getPriority(),
                new Progress(job.getProgressPercent(), job.getCurrentStep(), job.getStepsCompleted(),
                        job.getTotalSteps()),
                new Timing(job.getCreatedAt(), job.getStartedAt(), job.getCompletedAt(), job.getFailedAt(),
                        job.getCancelledAt(), job.getDurationMs()),
                job.getResult(),
                error,
                new AiUsage(job.getAiRequests(), job.getAiTokensInput(), job.getAiTokensOutput(), job.getAiCostUsd()),
                new RetryInfo(job.getRetryCount(), job.getMaxRetries(), job.getRetryAfter()));
    }

    public record Progress(int percent, String currentStep, int stepsCompleted, int totalSteps) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Timing(OffsetDateTime createdAt, OffsetDateTime startedAt, OffsetDateTime completedAt,
            OffsetDateTime failedAt, OffsetDateTime cancelledAt, Long durationMs) {
    }

    public record ErrorInfo(String code, String message, JsonNode details) {
    }

    public record AiUsage(int requests, long tokensInput, long tokensOutput, double costUsd) {
    }

    public record RetryInfo(int retryCount, int maxRetries, OffsetDateTime retryAfter) {
    }
}
