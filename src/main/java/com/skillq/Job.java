package com.skillq;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "skillq_jobs")
public class Job {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int priority = 5;

    @Column(name = "priority_reason")
    private String priorityReason;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @Column(name = "actor_id", nullable = false)
    private UUID actorId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode payload;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode result;

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_details", columnDefinition = "jsonb")
    private JsonNode errorDetails;

    @Column(name = "retry_count")
    private int retryCount = 0;

    @Column(name = "max_retries")
    private int maxRetries = 3;

    @Column(name = "retry_after")
    private OffsetDateTime retryAfter;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "retry_error_log", columnDefinition = "jsonb")
    private JsonNode retryErrorLog;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "claimed_at")
    private OffsetDateTime claimedAt;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "progress_percent")
    private int progressPercent = 0;

    @Column(name = "current_step")
    private String currentStep;

    @Column(name = "steps_completed")
    private int stepsCompleted = 0;

    @Column(name = "total_steps")
    private int totalSteps = 0;

    @Column(name = "last_progress_at")
    private OffsetDateTime lastProgressAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "ai_requests")
    private int aiRequests = 0;

    @Column(name = "ai_tokens_input")
    private long aiTokensInput = 0;

    @Column(name = "ai_tokens_output")
    private long aiTokensOutput = 0;

    @Column(name = "ai_cost_usd")
    private double aiCostUsd = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public Job() {
        this.createdAt = OffsetDateTime.now();
        this.updatedAt = createdAt;
    }

    public Job(UUID id, JobType type, UUID subjectId, UUID actorId, JsonNode payload, int maxRetries, int priority) {
        this();
        this.id = id;
        this.type = type;
        this.subjectId = subjectId;
        this.actorId = actorId;
        this.payload = payload;
        this.maxRetries = maxRetries;
        this.priority = priority;
    }

    public boolean isOwnedBy(String candidateWorkerId) {
        return status == JobStatus.PROCESSING && workerId != null && workerId.equals(candidateWorkerId);
    }

    public void clearWorker() {
        this.workerId = null;
        this.claimedAt = null;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public JobType getType() {
        return type;
    }

    public void setType(JobType type) {
        this.type = type;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public String getPriorityReason() {
        return priorityReason;
    }

    public void setPriorityReason(String priorityReason) {
        this.priorityReason = priorityReason;
    }

    public UUID getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(UUID subjectId) {
        this.subjectId = subjectId;
    }

    public UUID getActorId() {
        return actorId;
    }

    public void setActorId(UUID actorId) {
        this.actorId = actorId;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public JsonNode getResult() {
        return result;
    }

    public void setResult(JsonNode result) {
        this.result = result;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public JsonNode getErrorDetails() {
        return errorDetails;
    }

    public void setErrorDetails(JsonNode errorDetails) {
        this.errorDetails = errorDetails;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public OffsetDateTime getRetryAfter() {
        return retryAfter;
    }

    public void setRetryAfter(OffsetDateTime retryAfter) {
        this.retryAfter = retryAfter;
    }

    public JsonNode getRetryErrorLog() {
        return retryErrorLog;
    }

    public void setRetryErrorLog(JsonNode retryErrorLog) {
        this.retryErrorLog = retryErrorLog;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public OffsetDateTime getClaimedAt() {
        return claimedAt;
    }

    public void setClaimedAt(OffsetDateTime claimedAt) {
        this.claimedAt = claimedAt;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(OffsetDateTime failedAt) {
        this.failedAt = failedAt;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(OffsetDateTime cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public int getProgressPercent() {
        return progressPercent;
    }

    public void setProgressPercent(int progressPercent) {
        this.progressPercent = progressPercent;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public void setCurrentStep(String currentStep) {
        this.currentStep = currentStep;
    }

    public int getStepsCompleted() {
        return stepsCompleted;
    }

    public void setStepsCompleted(int stepsCompleted) {
        this.stepsCompleted = stepsCompleted;
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public void setTotalSteps(int totalSteps) {
        this.totalSteps = totalSteps;
    }

    public OffsetDateTime getLastProgressAt() {
        return lastProgressAt;
    }

    public void setLastProgressAt(OffsetDateTime lastProgressAt) {
        this.lastProgressAt = lastProgressAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public int getAiRequests() {
        return aiRequests;
    }

    public void setAiRequests(int aiRequests) {
        this.aiRequests = aiRequests;
    }

    public long getAiTokensInput() {
        return aiTokensInput;
    }

    public void setAiTokensInput(long aiTokensInput) {
        this.aiTokensInput = aiTokensInput;
    }

    public long getAiTokensOutput() {
        return aiTokensOutput;
    }

    public void setAiTokensOutput(long aiTokensOutput) {
        this.aiTokensOutput = aiTokensOutput;
    }

    public double getAiCostUsd() {
        return aiCostUsd;
    }

    public void setAiCostUsd(double aiCostUsd) {
        this.aiCostUsd = aiCostUsd;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
