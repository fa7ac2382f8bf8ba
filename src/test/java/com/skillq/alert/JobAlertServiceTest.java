package com.skillq.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillq.config.SkillQProperties;
import com.skillq.metrics.QueueMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class JobAlertServiceTest {

    private JobAlertRepository alertRepository;
    private QueueMetricsService queueMetricsService;
    private SkillQProperties properties;
    private JobAlertService service;

    @BeforeEach
    void setUp() {
        alertRepository = mock(JobAlertRepository.class);
        queueMetricsService = mock(QueueMetricsService.class);
        properties = new SkillQProperties();
        properties.getAlerts().setErrorRateThreshold(10.0);
        when(alertRepository.save(any(JobAlert.class))).thenAnswer(invocation -> invocation.getArgument(0));
        service = new JobAlertService(alertRepository, queueMetricsService, properties, new ObjectMapper());
    }

    @Test
    void failedJobRaisesErrorAlertWithDetails() {
        UUID jobId = UUID.randomUUID();

        JobAlert alert = service.jobFailed(jobId, "EXECUTION_ERROR", "provider timeout", 4).orElseThrow();

        assertEquals(jobId, alert.getJobId());
        assertEquals(AlertType.JOB_FAILED, alert.getType());
        assertEquals(AlertSeverity.ERROR, alert.getSeverity());
        assertEquals("EXECUTION_ERROR", alert.getDetails().get("errorCode").asText());
        assertEquals(4, alert.getDetails().get("attempts").asInt());
    }

    @Test
    void stuckJobRaisesWarning() {
        JobAlert alert = service.jobStuck(UUID.randomUUID(), "worker-7", null, true).orElseThrow();

        assertEquals(AlertSeverity.WARNING, alert.getSeverity());
        assertTrue(alert.getDetails().get("requeued").asBoolean());
    }

    @Test
    void storageFailureIsSwallowed() {
        when(alertRepository.save(any(JobAlert.class))).thenThrow(new IllegalStateException("read-only database"));

        assertTrue(service.jobFailed(UUID.randomUUID(), "X", "boom", 1).isEmpty());
    }

    @Test
    void disabledAlertsStoreNothing() {
        properties.getAlerts().setEnabled(false);

        assertEquals(Optional.empty(), service.raise(null, AlertType.JOB_FAILED, AlertSeverity.ERROR, "x", Map.of()));
        service.checkErrorRate();

        verifyNoInteractions(alertRepository, queueMetricsService);
    }

    @Test
    void errorRateAtThresholdRaisesNothing() {
        when(queueMetricsService.errorRate(any())).thenReturn(10.0);

        service.checkErrorRate();

        verify(alertRepository, never()).save(any(JobAlert.class));
    }

    @Test
    void errorRateAboveThresholdRaisesError() {
        when(queueMetricsService.errorRate(any())).thenReturn(15.0);

        service.checkErrorRate();

        ArgumentCaptor<JobAlert> captor = ArgumentCaptor.forClass(JobAlert.class);
        verify(alertRepository).save(captor.capture());
        assertEquals(AlertType.HIGH_ERROR_RATE, captor.getValue().getType());
        assertEquals(AlertSeverity.ERROR, captor.getValue().getSeverity());
    }

    @Test
    void errorRateAboveTwiceThresholdIsCritical() {
        when(queueMetricsService.errorRate(any())).thenReturn(25.0);

        service.checkErrorRate();

        ArgumentCaptor<JobAlert> captor = ArgumentCaptor.forClass(JobAlert.class);
        verify(alertRepository).save(captor.capture());
        assertEquals(AlertSeverity.CRITICAL, captor.getValue().getSeverity());
    }

    @Test
    void openAlertFromLastHourIsNotRepeated() {
        when(queueMetricsService.errorRate(any())).thenReturn(50.0);
        when(alertRepository.existsByTypeAndResolvedAtIsNullAndCreatedAtGreaterThanEqual(eq(AlertType.HIGH_ERROR_RATE),
                any())).thenReturn(true);

        service.checkErrorRate();

        verify(alertRepository, never()).save(any(JobAlert.class));
    }
}
