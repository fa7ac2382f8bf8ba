package com.skillq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillq.config.SkillQProperties;
import com.skillq.error.InvalidStateException;
import com.skillq.error.NotFoundException;
import com.skillq.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Producer-side API: enqueue, inspect and cancel jobs.
 */
@Service
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final SkillQProperties properties;
    private final TransactionTemplate transactionTemplate;

    public JobClient(JobRepository jobRepository, ObjectMapper objectMapper, SkillQProperties properties,
            TransactionTemplate transactionTemplate) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Enqueue a job by its API name, e.g. {@code complete_analysis}.
     */
    public UUID enqueue(String jobType, UUID subjectId, UUID actorId) {
        return enqueue(JobType.fromWireName(jobType), subjectId, actorId, null);
    }

    public UUID enqueue(JobType type, UUID subjectId, UUID actorId) {
        return enqueue(type, subjectId, actorId, null);
    }

    public UUID enqueue(JobType type, UUID subjectId, UUID actorId, Object payload) {
        return enqueue(type, subjectId, actorId, payload, properties.getJobs().getDefaultMaxRetries());
    }

    public UUID enqueue(JobType type, UUID subjectId, UUID actorId, Object payload, int maxRetries) {
        return submit(type, subjectId, actorId, payload, maxRetries).getId();
    }

    /**
     * Enqueue by API name and return the stored job, including its assigned priority.
     */
    public Job submit(String jobType, UUID subjectId, UUID actorId, Object payload) {
        return submit(JobType.fromWireName(jobType), subjectId, actorId, payload,
                properties.getJobs().getDefaultMaxRetries());
    }

    /**
     * Full enqueue method with all options.
     */
    public Job submit(JobType type, UUID subjectId, UUID actorId, Object payload, int maxRetries) {
        if (type == null) {
            throw new ValidationException("Job type must not be null", "jobType");
        }
        if (subjectId == null) {
            throw new ValidationException("subjectId must not be null", "subjectId");
        }
        if (actorId == null) {
            throw new ValidationException("actorId must not be null", "actorId");
        }
        validateMaxRetries(maxRetries);

        long completedAnalyses = type == JobType.COMPLETE_ANALYSIS
                ? jobRepository.countByActorIdAndTypeAndStatus(actorId, JobType.COMPLETE_ANALYSIS, JobStatus.COMPLETED)
                : 0L;
        PriorityAssigner.PriorityDecision decision = PriorityAssigner.assign(type, completedAnalyses);

        JsonNode jsonPayload = payload != null ? objectMapper.valueToTree(payload) : null;
        Job job = new Job(UUID.randomUUID(), type, subjectId, actorId, jsonPayload, maxRetries, decision.priority());
        job.setPriorityReason(decision.reason());
        job.setRetryErrorLog(objectMapper.createArrayNode());
        Job saved = jobRepository.save(job);
        log.debug("Enqueued job {} of type {} with priority {} ({})", job.getId(), type.wireName(),
                decision.priority(), decision.reason());
        return saved;
    }

    public Optional<Job> findJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    public Job getJob(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    /**
     * Cancel a pending or processing job. A running execution notices at its next checkpoint.
     */
    public void cancel(UUID jobId) {
        OffsetDateTime now = OffsetDateTime.now();
        Integer updated = transactionTemplate.execute(status -> jobRepository.markCancelled(
                jobId, now, JobStatus.CANCELLED, EnumSet.of(JobStatus.PENDING, JobStatus.PROCESSING)));
        if (updated != null && updated > 0) {
            log.info("Cancelled job {}", jobId);
            return;
        }

        JobStatus current = jobRepository.findStatusById(jobId)
                .orElseThrow(() -> new NotFoundException("Job", jobId));
        throw new InvalidStateException("Job " + jobId + " cannot be cancelled in status " + current,
                Map.of("jobId", jobId.toString(), "status", current.name()));
    }

    private void validateMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries must be >= 0", "maxRetries");
        }
    }
}
