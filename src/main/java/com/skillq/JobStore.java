package com.skillq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skillq.internal.RetryBackoff;
import com.skillq.skill.ProgressUpdate;
import com.skillq.skill.ResourceUsage;
import com.skillq.skill.SkillError;
import com.skillq.skill.SkillMetadata;
import com.skillq.skill.SkillResult;
import com.skillq.spi.ContentSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Worker-side transitions of a job row. Every transition after the claim is checked against the
 * claiming worker, so a worker that lost its job to the reaper or a cancellation cannot overwrite it.
 */
@Service
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    public static final int MAX_WORKER_ID_LENGTH = 200;

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final RetryBackoff retryBackoff;
    private final ContentSanitizer sanitizer;

    public JobStore(JobRepository jobRepository, ObjectMapper objectMapper, TransactionTemplate transactionTemplate,
            RetryBackoff retryBackoff, ContentSanitizer sanitizer) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.retryBackoff = retryBackoff;
        this.sanitizer = sanitizer;
    }

    public enum FailureOutcome {
        RETRY_SCHEDULED,
        FAILED,
        NOT_OWNED
    }

    /**
     * Claims the most urgent eligible job for {@code workerId}. Empty when nothing is eligible, or when a
     * concurrent claim started another job for the same subject first.
     * <p>
     * The claimed job's {@link Job#getWorkerId() owner} is {@code workerId} plus a suffix unique to this
     * claim. Later transitions must pass that owner, so a thread still holding an earlier claim of the
     * same job is rejected once the job was requeued and claimed again.
     */
    public Optional<Job> claimNext(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        if (workerId.length() > MAX_WORKER_ID_LENGTH) {
            throw new IllegalArgumentException("workerId must not exceed " + MAX_WORKER_ID_LENGTH + " characters");
        }
        String owner = workerId + "/" + UUID.randomUUID();
        try {
            Job claimed = transactionTemplate.execute(status -> {
                OffsetDateTime now = OffsetDateTime.now();
                List<Job> candidates = jobRepository.findNextClaimableForUpdate(
                        JobStatus.PENDING, JobStatus.PROCESSING, now, PageRequest.of(0, 1));
                if (candidates.isEmpty()) {
                    return null;
                }
                Job job = candidates.get(0);
                job.setStatus(JobStatus.PROCESSING);
                job.setWorkerId(owner);
                job.setClaimedAt(now);
                job.setStartedAt(now);
                job.setLastProgressAt(now);
                job.setProgressPercent(0);
                job.setCurrentStep(null);
                job.setUpdatedAt(now);
                return jobRepository.saveAndFlush(job);
            });
            if (claimed != null) {
                log.debug("Worker {} claimed job {} of type {} (priority {})", owner, claimed.getId(),
                        claimed.getType().wireName(), claimed.getPriority());
            }
            return Optional.ofNullable(claimed);
        } catch (DataIntegrityViolationException concurrentSubjectClaim) {
            log.debug("Claim by worker {} lost a race for a subject already in flight", workerId);
            return Optional.empty();
        }
    }

    /**
     * Stores a successful result. Returns false when the caller no longer owns the job.
     */
    public boolean complete(UUID jobId, String workerId, SkillResult<?> result) {
        JsonNode data = result.data() != null ? objectMapper.valueToTree(result.data()) : null;
        Boolean applied = transactionTemplate.execute(status -> jobRepository.findByIdForUpdate(jobId).map(job -> {
            if (!job.isOwnedBy(workerId)) {
                log.debug("Skipping completion of job {}: no longer owned by {}", jobId, workerId);
                return false;
            }
            OffsetDateTime now = OffsetDateTime.now();
            job.setStatus(JobStatus.COMPLETED);
            job.setResult(data);
            job.setCompletedAt(now);
            job.setProgressPercent(100);
            job.setCurrentStep("Completed");
            job.setLastProgressAt(now);
            job.setErrorCode(null);
            job.setErrorMessage(null);
            job.setErrorDetails(null);
            job.setRetryAfter(null);
            applyMetadata(job, result.metadata(), now);
            job.clearWorker();
            job.setUpdatedAt(now);
            jobRepository.save(job);
            return true;
        }).orElse(false));
        return Boolean.TRUE.equals(applied);
    }

    /**
     * Records a failed attempt. Retryable errors go back to {@link JobStatus#PENDING} with backoff until
     * {@code max_retries} is used up; everything else ends the job as {@link JobStatus#FAILED}.
     */
    public FailureOutcome fail(UUID jobId, String workerId, SkillError error, SkillMetadata metadata) {
        FailureOutcome outcome = transactionTemplate.execute(status -> jobRepository.findByIdForUpdate(jobId).map(job -> {
            if (!job.isOwnedBy(workerId)) {
                log.debug("Skipping failure of job {}: no longer owned by {}", jobId, workerId);
                return FailureOutcome.NOT_OWNED;
            }
            OffsetDateTime now = OffsetDateTime.now();
            String message = sanitizer.sanitize(error.message());
            appendToErrorLog(job, error.code(), message, now);
            job.setErrorCode(error.code());
            job.setErrorMessage(message);
            job.setErrorDetails(error.details().isEmpty() ? null : objectMapper.valueToTree(error.details()));
            applyMetadata(job, metadata, now);

            RetryBackoff.RetryDecision decision = retryBackoff.decide(job.getRetryCount(), job.getMaxRetries(),
                    error.retryable(), now);
            if (decision.retry()) {
                job.setStatus(JobStatus.PENDING);
                job.setRetryCount(decision.nextRetryCount());
                job.setRetryAfter(decision.retryAfter());
                job.setStartedAt(null);
            } else {
                job.setStatus(JobStatus.FAILED);
                job.setFailedAt(now);
            }
            job.clearWorker();
            job.setUpdatedAt(now);
            jobRepository.save(job);
            return decision.retry() ? FailureOutcome.RETRY_SCHEDULED : FailureOutcome.FAILED;
        }).orElse(FailureOutcome.NOT_OWNED));
        return outcome == null ? FailureOutcome.NOT_OWNED : outcome;
    }

    /**
     * Persists a progress report and refreshes the heartbeat. Returns false once the caller lost the job.
     */
    public boolean updateProgress(UUID jobId, String workerId, ProgressUpdate update) {
        OffsetDateTime now = OffsetDateTime.now();
        String step = sanitizer.sanitize(update.step());
        Integer updated = transactionTemplate.execute(status -> jobRepository.updateProgress(jobId, workerId,
                update.percent(), step, update.stepNumber(), update.totalSteps(), now, JobStatus.PROCESSING));
        return updated != null && updated > 0;
    }

    public Optional<JobStatus> currentStatus(UUID jobId) {
        return jobRepository.findStatusById(jobId);
    }

    private void appendToErrorLog(Job job, String code, String message, OffsetDateTime now) {
        ArrayNode errorLog = job.getRetryErrorLog() instanceof ArrayNode existing
                ? existing.deepCopy()
                : objectMapper.createArrayNode();
        ObjectNode entry = errorLog.addObject();
        entry.put("attempt", job.getRetryCount() + 1);
        entry.put("code", code);
        entry.put("message", message);
        entry.put("at", now.toString());
        job.setRetryErrorLog(errorLog);
    }

    private void applyMetadata(Job job, SkillMetadata metadata, OffsetDateTime now) {
        if (metadata != null) {
            job.setDurationMs(metadata.durationMs());
            ResourceUsage usage = metadata.resourceUsage();
            if (usage != null) {
                job.setAiRequests(job.getAiRequests() + usage.requests());
                job.setAiTokensInput(job.getAiTokensInput() + usage.tokensInput());
                job.setAiTokensOutput(job.getAiTokensOutput() + usage.tokensOutput());
                job.setAiCostUsd(job.getAiCostUsd() + usage.costUsd());
            }
        } else if (job.getStartedAt() != null) {
            job.setDurationMs(Duration.between(job.getStartedAt(), now).toMillis());
        }
    }
}
