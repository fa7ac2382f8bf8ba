package com.skillq.executor;

import com.skillq.Job;
import com.skillq.JobStatus;
import com.skillq.JobStore;
import com.skillq.JobType;
import com.skillq.error.InvalidJobTypeException;
import com.skillq.skill.ProgressUpdate;
import com.skillq.skill.ResourceUsage;
import com.skillq.skill.Skill;
import com.skillq.skill.SkillConfig;
import com.skillq.skill.SkillContext;
import com.skillq.skill.SkillError;
import com.skillq.skill.SkillMetadata;
import com.skillq.skill.SkillRegistry;
import com.skillq.skill.SkillResult;
import com.skillq.subject.EquipmentType;
import com.skillq.subject.HaulRecordRepository;
import com.skillq.subject.InvoiceRepository;
import com.skillq.subject.Project;
import com.skillq.subject.ProjectFileRepository;
import com.skillq.subject.ProjectRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SkillExecutorTest {

    private SkillRegistry skillRegistry;
    private ProjectRepository projectRepository;
    private JobStore jobStore;
    private SimpleMeterRegistry meterRegistry;
    private SkillExecutor executor;
    private Skill<String> skill;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        skillRegistry = mock(SkillRegistry.class);
        projectRepository = mock(ProjectRepository.class);
        InvoiceRepository invoiceRepository = mock(InvoiceRepository.class);
        HaulRecordRepository haulRecordRepository = mock(HaulRecordRepository.class);
        ProjectFileRepository projectFileRepository = mock(ProjectFileRepository.class);
        jobStore = mock(JobStore.class);
        meterRegistry = new SimpleMeterRegistry();
        ObjectProvider<MeterRegistry> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable(any())).thenReturn(meterRegistry);

        when(invoiceRepository.findByProjectIdOrderByInvoiceDateAsc(any())).thenReturn(List.of());
        when(haulRecordRepository.findByProjectIdOrderByHaulDateAsc(any())).thenReturn(List.of());
        when(projectFileRepository.findByProjectIdOrderByFileNameAsc(any())).thenReturn(List.of());
        when(skillRegistry.getConfig(any())).thenReturn(SkillConfig.canonical());

        skill = mock(Skill.class);
        doReturn(skill).when(skillRegistry).get("wastewise-analytics");

        executor = new SkillExecutor(skillRegistry, projectRepository, invoiceRepository, haulRecordRepository,
                projectFileRepository, jobStore, provider);
    }

    @Test
    void jobTypesMapToSkills() {
        assertEquals("wastewise-analytics", SkillExecutor.mapJobTypeToSkill(JobType.COMPLETE_ANALYSIS));
        assertEquals("wastewise-analytics", SkillExecutor.mapJobTypeToSkill(JobType.REPORT_GENERATION));
        assertEquals("batch-extractor", SkillExecutor.mapJobTypeToSkill(JobType.INVOICE_EXTRACTION));
        assertEquals("regulatory-research", SkillExecutor.mapJobTypeToSkill(JobType.REGULATORY_RESEARCH));
        assertThrows(InvalidJobTypeException.class, () -> SkillExecutor.mapJobTypeToSkill(null));
    }

    @Test
    void successIsReturnedAndCounted() {
        Job job = job();
        givenProject(job);
        SkillMetadata metadata = new SkillMetadata("wastewise-analytics", "1.0.0", 40, OffsetDateTime.now(),
                new ResourceUsage(2, 1000, 200, 0.4));
        when(skill.execute(any())).thenReturn(SkillResult.success("report", metadata));

        SkillResult<?> result = executor.execute(job, "worker-1");

        assertTrue(result.success());
        assertEquals("report", result.data());
        assertEquals(1.0, meterRegistry.get("skillq.skill.executions")
                .tags("skill", "wastewise-analytics", "outcome", "success", "code", "none").counter().count());
        assertEquals(1, meterRegistry.get("skillq.skill.duration").timer().count());
        assertEquals(2.0, meterRegistry.get("skillq.ai.requests").counter().count());
        assertEquals(0.4, meterRegistry.get("skillq.ai.cost").counter().count(), 1e-9);
    }

    @Test
    void contextIsWiredToTheJobRow() {
        Job job = job();
        Project project = givenProject(job);
        when(skill.execute(any())).thenReturn(SkillResult.success("ok", null));
        when(jobStore.currentStatus(job.getId())).thenReturn(Optional.of(JobStatus.CANCELLED));

        executor.execute(job, "worker-1");

        ArgumentCaptor<SkillContext> captor = ArgumentCaptor.forClass(SkillContext.class);
        verify(skill).execute(captor.capture());
        SkillContext context = captor.getValue();
        assertSame(project, context.project());
        assertEquals(job.getId(), context.jobId());
        assertEquals(job.getActorId(), context.actorId());

        ProgressUpdate update = ProgressUpdate.of(40, "Analyzing");
        context.reportProgress(update);
        verify(jobStore).updateProgress(eq(job.getId()), eq("worker-1"), eq(update));
        assertTrue(context.cancellationToken().isCancellationRequested());
    }

    @Test
    void missingProjectIsNonRetryableFailure() {
        Job job = job();
        when(projectRepository.findById(job.getSubjectId())).thenReturn(Optional.empty());

        SkillResult<?> result = executor.execute(job, "worker-1");

        assertFalse(result.success());
        assertEquals("NOT_FOUND", result.error().code());
        assertFalse(result.error().retryable());
        assertEquals(1.0, meterRegistry.get("skillq.skill.executions")
                .tags("outcome", "failure", "code", "NOT_FOUND").counter().count());
    }

    @Test
    void cancelledResultIsCountedSeparately() {
        Job job = job();
        givenProject(job);
        when(skill.execute(any())).thenReturn(SkillResult.failure(
                new SkillError("Execution was cancelled", "CANCELLED", null, false), null));

        executor.execute(job, "worker-1");

        assertEquals(1.0, meterRegistry.get("skillq.skill.executions").tags("outcome", "cancelled").counter()
                .count());
    }

    private Job job() {
        return new Job(UUID.randomUUID(), JobType.COMPLETE_ANALYSIS, UUID.randomUUID(), UUID.randomUUID(), null, 3,
                5);
    }

    private Project givenProject(Job job) {
        Project project = new Project(job.getSubjectId(), job.getActorId(), "Oak Terrace", 180,
                EquipmentType.COMPACTOR);
        when(projectRepository.findById(job.getSubjectId())).thenReturn(Optional.of(project));
        return project;
    }
}
