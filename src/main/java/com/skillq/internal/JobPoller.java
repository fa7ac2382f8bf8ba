package com.skillq.internal;

import com.skillq.Job;
import com.skillq.JobStore;
import com.skillq.alert.JobAlertService;
import com.skillq.config.SkillQProperties;
import com.skillq.executor.SkillExecutor;
import com.skillq.skill.SkillError;
import com.skillq.skill.SkillResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claims jobs up to the free capacity of the local worker pool and persists each outcome.
 */
@Component
@ConditionalOnProperty(prefix = "skillq.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

    private final JobStore jobStore;
    private final SkillExecutor skillExecutor;
    private final JobAlertService alertService;
    private final int workerCount;
    private final ThreadPoolExecutor processingExecutor;
    private final AtomicBoolean pollInProgress = new AtomicBoolean(false);

    private final String workerId = "worker-" + UUID.randomUUID();

    public JobPoller(JobStore jobStore, SkillExecutor skillExecutor, JobAlertService alertService,
            SkillQProperties properties) {
        this.jobStore = jobStore;
        this.skillExecutor = skillExecutor;
        this.alertService = alertService;
        this.workerCount = Math.max(1, properties.getWorker().getWorkerCount());

        int processingQueueCapacity = Math.max(32, workerCount * 8);
        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(processingQueueCapacity),
                new ThreadPoolExecutor.CallerRunsPolicy());
        log.info("Job poller {} started with {} worker threads", workerId, workerCount);
    }

    @Scheduled(fixedDelayString = "${skillq.worker.poll-interval-in-seconds:5}000")
    public void poll() {
        if (!pollInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            int availableSlots = availableProcessingSlots();
            // one claim per transaction keeps the per-subject check accurate
            for (int i = 0; i < availableSlots; i++) {
                Optional<Job> claimed = jobStore.claimNext(workerId);
                if (claimed.isEmpty()) {
                    break;
                }
                Job job = claimed.get();
                processingExecutor.execute(() -> processJob(job));
            }
        } catch (Exception e) {
            log.error("Polling for jobs failed on {}", workerId, e);
        } finally {
            pollInProgress.set(false);
        }
    }

    int availableProcessingSlots() {
        int inFlight = processingExecutor.getActiveCount() + processingExecutor.getQueue().size();
        return workerCount - inFlight;
    }

    void processJob(Job job) {
        try {
            SkillResult<?> result = skillExecutor.execute(job, job.getWorkerId());
            if (result.success()) {
                if (jobStore.complete(job.getId(), job.getWorkerId(), result)) {
                    log.info("Job {} completed", job.getId());
                } else {
                    log.info("Result of job {} discarded: job was reclaimed or cancelled", job.getId());
                }
                return;
            }
            if (result.isCancelled()) {
                log.info("Job {} stopped after cancellation", job.getId());
                return;
            }
            handleFailure(job, result);
        } catch (Exception e) {
            // the row stays PROCESSING and the reaper picks it up
            log.error("Failed to record outcome of job {}", job.getId(), e);
        }
    }

    private void handleFailure(Job job, SkillResult<?> result) {
        SkillError error = result.error();
        switch (jobStore.fail(job.getId(), job.getWorkerId(), error, result.metadata())) {
            case RETRY_SCHEDULED -> log.warn("Job {} failed with {} and will be retried: {}", job.getId(),
                    error.code(), error.message());
            case FAILED -> {
                log.error("Job {} failed permanently with {}: {}", job.getId(), error.code(), error.message());
                alertService.jobFailed(job.getId(), error.code(), error.message(), job.getRetryCount() + 1);
            }
            case NOT_OWNED -> log.info("Failure of job {} discarded: job was reclaimed or cancelled", job.getId());
        }
    }

    String getWorkerId() {
        return workerId;
    }

    @PreDestroy
    void shutdownExecutor() {
        processingExecutor.shutdown();
    }
}
