package com.skillq.metrics;

import com.skillq.JobRepository;
import com.skillq.JobStatus;
import com.skillq.config.SkillQProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only queue statistics. "Today" is the current UTC calendar day.
 */
@Service
public class QueueMetricsService {

    private final JobRepository jobRepository;
    private final SkillQProperties properties;

    public QueueMetricsService(JobRepository jobRepository, SkillQProperties properties) {
        this.jobRepository = jobRepository;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public QueueMetrics getQueueMetrics() {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        OffsetDateTime startOfDay = LocalDate.now(ZoneOffset.UTC).atStartOfDay().atOffset(ZoneOffset.UTC);

        Map<JobStatus, Long> byStatus = countsByStatus();
        Map<Integer, Long> byPriority = new LinkedHashMap<>();
        for (JobRepository.PriorityCount count : jobRepository.countByPriorityForStatus(JobStatus.PENDING)) {
            byPriority.put(count.getPriority(), count.getJobCount());
        }

        Double avgMs = jobRepository.averageDurationMs(JobStatus.COMPLETED, now.minusHours(24));
        double avgSeconds = avgMs == null ? 0.0 : round2(avgMs / 1000.0);

        return new QueueMetrics(
                byStatus.getOrDefault(JobStatus.PENDING, 0L),
                byStatus.getOrDefault(JobStatus.PROCESSING, 0L),
                jobRepository.countByStatusAndFailedAtGreaterThanEqual(JobStatus.FAILED, startOfDay),
                jobRepository.countByStatusAndCompletedAtGreaterThanEqual(JobStatus.COMPLETED, startOfDay),
                byPriority,
                avgSeconds,
                errorRate(now.minusHours(1)),
                errorRate(now.minusHours(24)),
                jobRepository.countStuck(JobStatus.PROCESSING, now.minus(stuckThreshold())));
    }

    /**
     * Failed share of the jobs created since {@code since}, in percent with two decimals.
     */
    @Transactional(readOnly = true)
    public double errorRate(OffsetDateTime since) {
        long created = jobRepository.countByCreatedAtGreaterThanEqual(since);
        if (created == 0) {
            return 0.0;
        }
        long failed = jobRepository.countByStatusAndCreatedAtGreaterThanEqual(JobStatus.FAILED, since);
        return round2(failed * 100.0 / created);
    }

    @Transactional(readOnly = true)
    public Map<JobStatus, Long> countsByStatus() {
        Map<JobStatus, Long> counts = new LinkedHashMap<>();
        for (JobRepository.StatusCount count : jobRepository.countByStatus()) {
            counts.put(count.getStatus(), count.getJobCount() == null ? 0L : count.getJobCount());
        }
        return counts;
    }

    private Duration stuckThreshold() {
        return properties.getReaper().getStuckThreshold();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
