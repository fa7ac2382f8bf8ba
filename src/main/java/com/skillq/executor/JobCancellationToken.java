package com.skillq.executor;

import com.skillq.JobStatus;
import com.skillq.JobStore;
import com.skillq.skill.CancellationToken;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Cancellation token backed by the job row. The status is read at most once per poll interval;
 * once cancellation was observed the token stays cancelled.
 */
class JobCancellationToken implements CancellationToken {

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    private final JobStore jobStore;
    private final UUID jobId;
    private final long pollIntervalNanos;

    private volatile boolean cancelled;
    private volatile long lastCheckNanos;
    private volatile boolean checkedOnce;

    JobCancellationToken(JobStore jobStore, UUID jobId, Duration pollInterval) {
        this.jobStore = jobStore;
        this.jobId = jobId;
        this.pollIntervalNanos = pollInterval.toNanos();
    }

    @Override
    public boolean isCancellationRequested() {
        if (cancelled) {
            return true;
        }
        long now = System.nanoTime();
        if (checkedOnce && now - lastCheckNanos < pollIntervalNanos) {
            return false;
        }
        checkedOnce = true;
        lastCheckNanos = now;
        Optional<JobStatus> status = jobStore.currentStatus(jobId);
        // a deleted row counts as cancelled
        cancelled = status.map(s -> s == JobStatus.CANCELLED).orElse(true);
        return cancelled;
    }
}
