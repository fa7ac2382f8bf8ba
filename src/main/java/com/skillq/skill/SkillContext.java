package com.skillq.skill;

import com.skillq.subject.HaulRecord;
import com.skillq.subject.Invoice;
import com.skillq.subject.Project;
import com.skillq.subject.ProjectFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * Everything one skill execution needs, assembled fresh for that execution and never persisted.
 * Collections are read-only snapshots taken when the context was built.
 */
public final class SkillContext {

    private static final Logger log = LoggerFactory.getLogger(SkillContext.class);

    private final UUID jobId;
    private final UUID subjectId;
    private final UUID actorId;
    private final Project project;
    private final List<Invoice> invoices;
    private final List<HaulRecord> haulLog;
    private final List<ProjectFile> files;
    private final SkillConfig config;
    private final ProgressListener progressListener;
    private final CancellationToken cancellationToken;

    private SkillContext(Builder builder) {
        this.jobId = builder.jobId;
        this.subjectId = builder.subjectId;
        this.actorId = builder.actorId;
        this.project = builder.project;
        this.invoices = List.copyOf(builder.invoices);
        this.haulLog = List.copyOf(builder.haulLog);
        this.files = List.copyOf(builder.files);
        this.config = builder.config;
        this.progressListener = builder.progressListener;
        this.cancellationToken = builder.cancellationToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .jobId(jobId)
                .subjectId(subjectId)
                .actorId(actorId)
                .project(project)
                .invoices(invoices)
                .haulLog(haulLog)
                .files(files)
                .config(config)
                .progressListener(progressListener)
                .cancellationToken(cancellationToken);
    }

    /**
     * Checkpoint: throws {@link com.skillq.error.CancelledException} once cancellation was requested.
     */
    public void checkCancellation() {
        cancellationToken.throwIfCancellationRequested();
    }

    /**
     * Forwards a progress update. A failing listener is logged and never fails the execution.
     */
    public void reportProgress(ProgressUpdate update) {
        try {
            progressListener.onProgress(update);
        } catch (RuntimeException e) {
            log.warn("Progress update {}% '{}' for job {} could not be recorded: {}", update.percent(),
                    update.step(), jobId, e.getMessage());
        }
    }

    public void reportProgress(int percent, String step) {
        reportProgress(ProgressUpdate.of(percent, step));
    }

    public UUID jobId() {
        return jobId;
    }

    public UUID subjectId() {
        return subjectId;
    }

    public UUID actorId() {
        return actorId;
    }

    public Project project() {
        return project;
    }

    public List<Invoice> invoices() {
        return invoices;
    }

    public List<HaulRecord> haulLog() {
        return haulLog;
    }

    public List<ProjectFile> files() {
        return files;
    }

    public SkillConfig config() {
        return config;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public static final class Builder {
        private UUID jobId;
        private UUID subjectId;
        private UUID actorId;
        private Project project;
        private List<Invoice> invoices = List.of();
        private List<HaulRecord> haulLog = List.of();
        private List<ProjectFile> files = List.of();
        private SkillConfig config = SkillConfig.canonical();
        private ProgressListener progressListener = ProgressListener.NONE;
        private CancellationToken cancellationToken = CancellationToken.NONE;

        private Builder() {
        }

        public Builder jobId(UUID jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder subjectId(UUID subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder actorId(UUID actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder project(Project project) {
            this.project = project;
            return this;
        }

        public Builder invoices(List<Invoice> invoices) {
            this.invoices = invoices == null ? List.of() : invoices;
            return this;
        }

        public Builder haulLog(List<HaulRecord> haulLog) {
            this.haulLog = haulLog == null ? List.of() : haulLog;
            return this;
        }

        public Builder files(List<ProjectFile> files) {
            this.files = files == null ? List.of() : files;
            return this;
        }

        public Builder config(SkillConfig config) {
            this.config = config;
            return this;
        }

        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken == null ? CancellationToken.NONE : cancellationToken;
            return this;
        }

        public SkillContext build() {
            return new SkillContext(this);
        }
    }
}
