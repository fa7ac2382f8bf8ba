package com.skillq.skill;

import com.skillq.error.FormulaValidationException;
import com.skillq.error.SkillExecutionException;
import com.skillq.error.SkillQException;
import com.skillq.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Execution envelope shared by every skill: validate, report progress 0, run the algorithm,
 * report progress 100, and turn whatever happened into a {@link SkillResult}.
 * <p>
 * Subclasses implement {@link #executeInternal(SkillContext)} and may add checks through
 * {@link #validateInput(SkillContext, List)}. Errors thrown by the algorithm keep their code when
 * they are {@link SkillQException}s and become {@code EXECUTION_ERROR} otherwise.
 *
 * @param <T> result data type
 */
public abstract class AbstractSkill<T> implements Skill<T> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public final ValidationResult validate(SkillContext context) {
        List<ValidationIssue> errors = new ArrayList<>();
        if (context.subjectId() == null) {
            errors.add(new ValidationIssue("projectId", "Project ID is required", "MISSING_PROJECT_ID"));
        }
        if (context.actorId() == null) {
            errors.add(new ValidationIssue("userId", "User ID is required", "MISSING_USER_ID"));
        }
        if (context.project() == null) {
            errors.add(new ValidationIssue("project", "Project data is required", "MISSING_PROJECT_DATA"));
        } else {
            validateInput(context, errors);
        }
        return ValidationResult.of(errors);
    }

    /**
     * Domain-specific preconditions. Only called once the subject record is present.
     */
    protected void validateInput(SkillContext context, List<ValidationIssue> errors) {
    }

    protected abstract T executeInternal(SkillContext context) throws Exception;

    /**
     * Usage reported in the result metadata. Skills calling metered providers override this.
     */
    protected ResourceUsage resourceUsage(T data) {
        return null;
    }

    @Override
    public final SkillResult<T> execute(SkillContext context) {
        OffsetDateTime executedAt = OffsetDateTime.now();
        long started = System.nanoTime();

        ValidationResult validation = validate(context);
        if (!validation.valid()) {
            log.warn("Validation failed for skill {} on project {}: {}", name(), context.subjectId(),
                    validation.errors());
            SkillError error = new SkillError("Validation failed for " + name(), ValidationException.CODE,
                    Map.of("errors", validation.errors()), false);
            return SkillResult.failure(error, metadata(executedAt, started, null));
        }

        try {
            log.info("Executing skill {} v{} for project {}", name(), version(), context.subjectId());
            context.reportProgress(0, "Starting " + name());
            T data = executeInternal(context);
            context.reportProgress(100, "Completed");
            SkillMetadata metadata = metadata(executedAt, started, resourceUsage(data));
            log.info("Skill {} completed for project {} in {} ms", name(), context.subjectId(),
                    metadata.durationMs());
            return SkillResult.success(data, metadata);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            SkillError error = SkillError.from(e);
            if (e instanceof SkillQException) {
                log.warn("Skill {} failed for project {} with {}: {}", name(), context.subjectId(), error.code(),
                        error.message());
            } else {
                log.error("Skill {} failed unexpectedly for project {}", name(), context.subjectId(), e);
            }
            ResourceUsage usage = e instanceof SkillExecutionException executionError
                    ? executionError.getResourceUsage()
                    : null;
            return SkillResult.failure(error, metadata(executedAt, started, usage));
        }
    }

    /**
     * Fails with {@link FormulaValidationException} when the context config differs from
     * {@link FormulaConstants}.
     */
    protected void validateFormulas(SkillContext context) {
        SkillConfig config = context.config();
        if (config == null) {
            throw new FormulaValidationException("No formula configuration available for " + name(), Map.of());
        }
        Map<String, Object> mismatches = FormulaConstants.mismatches(config);
        if (!mismatches.isEmpty()) {
            throw new FormulaValidationException(
                    "Formula configuration for " + name() + " does not match canonical constants: "
                            + mismatches.keySet(),
                    mismatches);
        }
    }

    private SkillMetadata metadata(OffsetDateTime executedAt, long startedNanos, ResourceUsage usage) {
        long durationMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
        return new SkillMetadata(name(), version(), durationMs, executedAt, usage);
    }
}
