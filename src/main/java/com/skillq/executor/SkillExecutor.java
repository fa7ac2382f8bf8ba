package com.skillq.executor;

import com.skillq.Job;
import com.skillq.JobStore;
import com.skillq.JobType;
import com.skillq.error.InvalidJobTypeException;
import com.skillq.error.NotFoundException;
import com.skillq.skill.CancellationToken;
import com.skillq.skill.ProgressListener;
import com.skillq.skill.ResourceUsage;
import com.skillq.skill.Skill;
import com.skillq.skill.SkillConfig;
import com.skillq.skill.SkillContext;
import com.skillq.skill.SkillError;
import com.skillq.skill.SkillMetadata;
import com.skillq.skill.SkillRegistry;
import com.skillq.skill.SkillResult;
import com.skillq.skill.impl.BatchExtractorSkill;
import com.skillq.skill.impl.RegulatoryResearchSkill;
import com.skillq.skill.impl.WasteWiseAnalyticsSkill;
import com.skillq.subject.HaulRecordRepository;
import com.skillq.subject.InvoiceRepository;
import com.skillq.subject.Project;
import com.skillq.subject.ProjectFileRepository;
import com.skillq.subject.ProjectRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Runs one claimed job: resolves its skill, assembles a fresh context wired to the job row for
 * progress and cancellation, executes, and records execution metrics. Persisting the outcome is left
 * to the caller.
 */
@Service
public class SkillExecutor {

    private static final Logger log = LoggerFactory.getLogger(SkillExecutor.class);

    private final SkillRegistry skillRegistry;
    private final ProjectRepository projectRepository;
    private final InvoiceRepository invoiceRepository;
    private final HaulRecordRepository haulRecordRepository;
    private final ProjectFileRepository projectFileRepository;
    private final JobStore jobStore;
    private final MeterRegistry meterRegistry;

    public SkillExecutor(
            SkillRegistry skillRegistry,
            ProjectRepository projectRepository,
            InvoiceRepository invoiceRepository,
            HaulRecordRepository haulRecordRepository,
            ProjectFileRepository projectFileRepository,
            JobStore jobStore,
            ObjectProvider<MeterRegistry> meterRegistry) {
        this.skillRegistry = skillRegistry;
        this.projectRepository = projectRepository;
        this.invoiceRepository = invoiceRepository;
        this.haulRecordRepository = haulRecordRepository;
        this.projectFileRepository = projectFileRepository;
        this.jobStore = jobStore;
        this.meterRegistry = meterRegistry.getIfAvailable(() -> Metrics.globalRegistry);
    }

    public static String mapJobTypeToSkill(JobType jobType) {
        if (jobType == null) {
            throw new InvalidJobTypeException(null, JobType.wireNames());
        }
        return switch (jobType) {
            case COMPLETE_ANALYSIS, REPORT_GENERATION -> WasteWiseAnalyticsSkill.NAME;
            case INVOICE_EXTRACTION -> BatchExtractorSkill.NAME;
            case REGULATORY_RESEARCH -> RegulatoryResearchSkill.NAME;
        };
    }

    /**
     * Loads the subject data and the validated configuration of {@code skillName}.
     *
     * @throws NotFoundException when the project, the skill or its configuration does not exist
     */
    public SkillContext buildContext(UUID jobId, UUID subjectId, UUID actorId, String skillName,
            ProgressListener progressListener, CancellationToken cancellationToken) {
        Project project = projectRepository.findById(subjectId)
                .orElseThrow(() -> new NotFoundException("Project", subjectId));
        SkillConfig config = skillRegistry.getConfig(skillName);
        return SkillContext.builder()
                .jobId(jobId)
                .subjectId(subjectId)
                .actorId(actorId)
                .project(project)
                .invoices(invoiceRepository.findByProjectIdOrderByInvoiceDateAsc(subjectId))
                .haulLog(haulRecordRepository.findByProjectIdOrderByHaulDateAsc(subjectId))
                .files(projectFileRepository.findByProjectIdOrderByFileNameAsc(subjectId))
                .config(config)
                .progressListener(progressListener)
                .cancellationToken(cancellationToken)
                .build();
    }

    /**
     * Executes {@code job} for the claim owner {@code workerId}, as recorded by {@link JobStore#claimNext}.
     * Never throws: setup failures are reported through the returned result the same way skill
     * failures are.
     */
    public SkillResult<?> execute(Job job, String workerId) {
        OffsetDateTime executedAt = OffsetDateTime.now();
        long started = System.nanoTime();
        String skillName = "unknown";
        SkillResult<?> result;
        try {
            skillName = mapJobTypeToSkill(job.getType());
            Skill<?> skill = skillRegistry.get(skillName);
            ProgressListener progress = update -> jobStore.updateProgress(job.getId(), workerId, update);
            CancellationToken cancellation = new JobCancellationToken(jobStore, job.getId(),
                    JobCancellationToken.DEFAULT_POLL_INTERVAL);
            SkillContext context = buildContext(job.getId(), job.getSubjectId(), job.getActorId(), skillName,
                    progress, cancellation);
            log.info("Executing job {} ({}) with skill {} on worker {}", job.getId(), job.getType().wireName(),
                    skillName, workerId);
            result = skill.execute(context);
        } catch (RuntimeException e) {
            SkillError error = SkillError.from(e);
            log.warn("Job {} could not be started with skill {}: {} {}", job.getId(), skillName, error.code(),
                    error.message());
            long durationMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            result = SkillResult.failure(error, new SkillMetadata(skillName, null, durationMs, executedAt, null));
        }
        record(skillName, result, System.nanoTime() - started);
        return result;
    }

    private void record(String skillName, SkillResult<?> result, long elapsedNanos) {
        String outcome = result.success() ? "success" : result.isCancelled() ? "cancelled" : "failure";
        String code = result.success() ? "none" : result.error().code();
        Timer.builder("skillq.skill.duration")
                .description("Skill execution time")
                .tags("skill", skillName, "outcome", outcome)
                .register(meterRegistry)
                .record(Duration.ofNanos(elapsedNanos));
        Counter.builder("skillq.skill.executions")
                .description("Skill executions by outcome")
                .tags("skill", skillName, "outcome", outcome, "code", code)
                .register(meterRegistry)
                .increment();

        SkillMetadata metadata = result.metadata();
        ResourceUsage usage = metadata != null ? metadata.resourceUsage() : null;
        if (usage != null && usage.requests() > 0) {
            Counter.builder("skillq.ai.requests")
                    .tag("skill", skillName)
                    .register(meterRegistry)
                    .increment(usage.requests());
            Counter.builder("skillq.ai.cost")
                    .baseUnit("usd")
                    .tag("skill", skillName)
                    .register(meterRegistry)
                    .increment(usage.costUsd());
        }
    }
}
