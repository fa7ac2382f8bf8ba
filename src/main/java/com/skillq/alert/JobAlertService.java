package com.skillq.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillq.config.SkillQProperties;
import com.skillq.metrics.QueueMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records operational alerts. A failure to store an alert is logged and never propagates into
 * the job pipeline.
 */
@Service
public class JobAlertService {

    private static final Logger log = LoggerFactory.getLogger(JobAlertService.class);

    private final JobAlertRepository alertRepository;
    private final QueueMetricsService queueMetricsService;
    private final SkillQProperties properties;
    private final ObjectMapper objectMapper;

    public JobAlertService(JobAlertRepository alertRepository, QueueMetricsService queueMetricsService,
            SkillQProperties properties, ObjectMapper objectMapper) {
        this.alertRepository = alertRepository;
        this.queueMetricsService = queueMetricsService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<JobAlert> raise(UUID jobId, AlertType type, AlertSeverity severity, String message,
            Map<String, ?> details) {
        if (!properties.getAlerts().isEnabled()) {
            return Optional.empty();
        }
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[{}] {} (job {})", type, message, jobId);
            case WARNING -> log.warn("[{}] {} (job {})", type, message, jobId);
        }
        try {
            JobAlert alert = new JobAlert(UUID.randomUUID(), jobId, type, severity, message,
                    details == null || details.isEmpty() ? null : objectMapper.valueToTree(details));
            return Optional.of(alertRepository.save(alert));
        } catch (RuntimeException e) {
            log.error("Failed to store {} alert for job {}: {}", type, jobId, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<JobAlert> jobFailed(UUID jobId, String errorCode, String errorMessage, int attempts) {
        return raise(jobId, AlertType.JOB_FAILED, AlertSeverity.ERROR,
                "Job failed after " + attempts + " attempt(s): " + errorMessage,
                Map.of("errorCode", String.valueOf(errorCode), "attempts", attempts));
    }

    public Optional<JobAlert> jobStuck(UUID jobId, String workerId, OffsetDateTime lastHeartbeat, boolean requeued) {
        return raise(jobId, AlertType.JOB_STUCK, AlertSeverity.WARNING,
                "Job made no progress since " + lastHeartbeat + (requeued ? ", requeued" : ", failed"),
                Map.of("workerId", String.valueOf(workerId), "requeued", requeued));
    }

    /**
     * Raises {@link AlertType#HIGH_ERROR_RATE} when the last hour's error rate exceeds the configured
     * threshold, at most once per hour while the previous alert is unresolved.
     */
    @Scheduled(fixedDelayString = "${skillq.alerts.check-interval-in-seconds:300}000",
            initialDelayString = "${skillq.alerts.check-interval-in-seconds:300}000")
    public void checkErrorRate() {
        if (!properties.getAlerts().isEnabled()) {
            return;
        }
        try {
            OffsetDateTime now = OffsetDateTime.now();
            double threshold = properties.getAlerts().getErrorRateThreshold();
            double rate = queueMetricsService.errorRate(now.minusHours(1));
            if (rate <= threshold) {
                return;
            }
            if (alertRepository.existsByTypeAndResolvedAtIsNullAndCreatedAtGreaterThanEqual(
                    AlertType.HIGH_ERROR_RATE, now.minusHours(1))) {
                log.debug("Error rate {}% still above threshold, alert already open", rate);
                return;
            }
            AlertSeverity severity = rate > threshold * 2 ? AlertSeverity.CRITICAL : AlertSeverity.ERROR;
            raise(null, AlertType.HIGH_ERROR_RATE, severity,
                    "Error rate over the last hour is " + rate + "% (threshold " + threshold + "%)",
                    Map.of("errorRate", rate, "threshold", threshold));
        } catch (Exception e) {
            log.error("Error rate check failed: {}", e.getMessage());
        }
    }
}
