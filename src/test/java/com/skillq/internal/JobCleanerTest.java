package com.skillq.internal;

import com.skillq.JobRepository;
import com.skillq.JobStatus;
import com.skillq.config.SkillQProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobCleanerTest {

    @Test
    void shouldParseShorthandAndIsoDurations() {
        assertEquals(Duration.ofHours(36), JobCleaner.parseDuration("36h"));
        assertEquals(Duration.ofDays(7), JobCleaner.parseDuration(" 7D "));
        assertEquals(Duration.ofMinutes(90), JobCleaner.parseDuration("90m"));
        assertEquals(Duration.ofHours(2), JobCleaner.parseDuration("PT2H"));
        assertThrows(IllegalArgumentException.class, () -> JobCleaner.parseDuration("3w"));
    }

    @Test
    void shouldDeleteFinishedJobsPastRetention() {
        JobRepository jobRepository = mock(JobRepository.class);
        SkillQProperties properties = new SkillQProperties();
        properties.getWorker().setDeleteSucceededJobsAfter("1d");
        properties.getWorker().setDeleteFailedJobsAfter("3d");
        when(jobRepository.deleteByStatusAndCompletedAtBefore(eq(JobStatus.COMPLETED), any())).thenReturn(4);

        new JobCleaner(jobRepository, properties).cleanup();

        OffsetDateTime dayAgo = OffsetDateTime.now().minusDays(1);
        verify(jobRepository).deleteByStatusAndCompletedAtBefore(eq(JobStatus.COMPLETED),
                argThat(threshold -> Duration.between(threshold, dayAgo).abs().getSeconds() < 60));
        verify(jobRepository).deleteByStatusAndFailedAtBefore(eq(JobStatus.FAILED), any());
        verify(jobRepository).deleteByStatusAndCancelledAtBefore(eq(JobStatus.CANCELLED), any());
    }

    @Test
    void blankRetentionKeepsJobs() {
        JobRepository jobRepository = mock(JobRepository.class);
        SkillQProperties properties = new SkillQProperties();
        properties.getWorker().setDeleteSucceededJobsAfter("");
        properties.getWorker().setDeleteFailedJobsAfter(" ");

        new JobCleaner(jobRepository, properties).cleanup();

        verify(jobRepository, never()).deleteByStatusAndCompletedAtBefore(any(), any());
        verify(jobRepository, never()).deleteByStatusAndFailedAtBefore(any(), any());
    }
}
