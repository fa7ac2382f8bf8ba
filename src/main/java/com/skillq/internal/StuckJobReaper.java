package com.skillq.internal;

import com.skillq.Job;
import com.skillq.JobRepository;
import com.skillq.JobStatus;
import com.skillq.alert.JobAlertService;
import com.skillq.config.SkillQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Returns jobs whose worker stopped reporting progress to the queue, or fails them with
 * {@value #JOB_TIMEOUT} once their retries are used up.
 */
@Component
@ConditionalOnProperty(prefix = "skillq.reaper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StuckJobReaper {

    private static final Logger log = LoggerFactory.getLogger(StuckJobReaper.class);

    public static final String JOB_TIMEOUT = "JOB_TIMEOUT";

    private final JobRepository jobRepository;
    private final TransactionTemplate transactionTemplate;
    private final RetryBackoff retryBackoff;
    private final JobAlertService alertService;
    private final SkillQProperties properties;

    public StuckJobReaper(JobRepository jobRepository, TransactionTemplate transactionTemplate,
            RetryBackoff retryBackoff, JobAlertService alertService, SkillQProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionTemplate = transactionTemplate;
        this.retryBackoff = retryBackoff;
        this.alertService = alertService;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${skillq.reaper.interval-in-seconds:60}000",
            initialDelayString = "${skillq.reaper.interval-in-seconds:60}000")
    public void scheduledReap() {
        try {
            reap();
        } catch (Exception e) {
            log.error("Stuck job reaper run failed: {}", e.getMessage());
        }
    }

    /**
     * @return number of jobs requeued or failed by this run
     */
    public int reap() {
        Duration stuckAfter = properties.getReaper().getStuckThreshold();
        OffsetDateTime now = OffsetDateTime.now();
        OffsetDateTime threshold = now.minus(stuckAfter);
        List<Job> stuck = jobRepository.findStuck(JobStatus.PROCESSING, threshold,
                PageRequest.of(0, Math.max(1, properties.getReaper().getBatchSize())));
        int reaped = 0;
        for (Job job : stuck) {
            if (reap(job, threshold, now, stuckAfter)) {
                reaped++;
            }
        }
        if (reaped > 0) {
            log.warn("Reaped {} stuck jobs with no progress for {}", reaped, stuckAfter);
        }
        return reaped;
    }

    private boolean reap(Job job, OffsetDateTime threshold, OffsetDateTime now, Duration stuckAfter) {
        String message = "Job made no progress for " + stuckAfter.toMinutes() + " minutes";
        RetryBackoff.RetryDecision decision = retryBackoff.decide(job.getRetryCount(), job.getMaxRetries(), true,
                now);
        Integer updated = transactionTemplate.execute(status -> decision.retry()
                ? jobRepository.requeueStuck(job.getId(), job.getWorkerId(), job.getRetryCount(),
                        decision.nextRetryCount(), decision.retryAfter(), JOB_TIMEOUT, message, threshold, now,
                        JobStatus.PENDING, JobStatus.PROCESSING)
                : jobRepository.failStuck(job.getId(), job.getWorkerId(), job.getRetryCount(), JOB_TIMEOUT,
                        message, threshold, now, JobStatus.FAILED, JobStatus.PROCESSING));
        if (updated == null || updated == 0) {
            log.debug("Job {} changed while being reaped, leaving it alone", job.getId());
            return false;
        }
        OffsetDateTime heartbeat = job.getLastProgressAt() != null ? job.getLastProgressAt() : job.getStartedAt();
        alertService.jobStuck(job.getId(), job.getWorkerId(), heartbeat, decision.retry());
        if (!decision.retry()) {
            alertService.jobFailed(job.getId(), JOB_TIMEOUT, message, job.getRetryCount() + 1);
        }
        return true;
    }
}
