package com.skillq.internal;

import com.skillq.JobRepository;
import com.skillq.JobStatus;
import com.skillq.config.SkillQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;

@Component
@ConditionalOnProperty(prefix = "skillq.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private final JobRepository jobRepository;
    private final SkillQProperties properties;

    public JobCleaner(JobRepository jobRepository, SkillQProperties properties) {
        this.jobRepository = jobRepository;
        this.properties = properties;
    }

    // hourly
    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        log.debug("Running finished job cleanup");

        String completedRetention = properties.getWorker().getDeleteSucceededJobsAfter();
        if (completedRetention != null && !completedRetention.isBlank()) {
            try {
                Duration retention = parseDuration(completedRetention);
                int deleted = jobRepository.deleteByStatusAndCompletedAtBefore(JobStatus.COMPLETED,
                        OffsetDateTime.now().minus(retention));
                if (deleted > 0) {
                    log.info("Deleted {} completed jobs older than {}", deleted, retention);
                }
            } catch (Exception e) {
                log.error("Failed to clean up completed jobs: {}", e.getMessage());
            }
        }

        String failedRetention = properties.getWorker().getDeleteFailedJobsAfter();
        if (failedRetention != null && !failedRetention.isBlank()) {
            try {
                Duration retention = parseDuration(failedRetention);
                OffsetDateTime threshold = OffsetDateTime.now().minus(retention);
                int failed = jobRepository.deleteByStatusAndFailedAtBefore(JobStatus.FAILED, threshold);
                int cancelled = jobRepository.deleteByStatusAndCancelledAtBefore(JobStatus.CANCELLED, threshold);
                if (failed + cancelled > 0) {
                    log.info("Deleted {} failed and {} cancelled jobs older than {}", failed, cancelled, retention);
                }
            } catch (Exception e) {
                log.error("Failed to clean up failed and cancelled jobs: {}", e.getMessage());
            }
        }
    }

    /**
     * Accepts ISO-8601 durations and the shorthands {@code 36h}, {@code 7d} and {@code 90m}.
     */
    static Duration parseDuration(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            return Duration.parse(trimmed);
        }
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        long amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
        return switch (shorthand.charAt(shorthand.length() - 1)) {
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Unsupported duration value: " + value);
        };
    }
}
