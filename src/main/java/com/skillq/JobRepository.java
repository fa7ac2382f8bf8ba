package com.skillq;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    interface StatusCount {
        JobStatus getStatus();

        Long getJobCount();
    }

    interface PriorityCount {
        Integer getPriority();

        Long getJobCount();
    }

    /**
     * Next claimable jobs, locked with {@code FOR UPDATE SKIP LOCKED}. Rows held by a concurrent
     * claim are skipped instead of waited on, and subjects that already have a job in flight are
     * left out.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT j FROM Job j
            WHERE j.status = :pending
              AND (j.retryAfter IS NULL OR j.retryAfter <= :now)
              AND NOT EXISTS (
                  SELECT 1 FROM Job running
                  WHERE running.subjectId = j.subjectId
                    AND running.status = :processing)
            ORDER BY j.priority ASC, j.createdAt ASC
            """)
    List<Job> findNextClaimableForUpdate(
            @Param("pending") JobStatus pending,
            @Param("processing") JobStatus processing,
            @Param("now") OffsetDateTime now,
            Pageable pageable);

    /**
     * Blocking row lock used for ownership-checked transitions of a job the caller already holds.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT j.status FROM Job j WHERE j.id = :id")
    Optional<JobStatus> findStatusById(@Param("id") UUID id);

    long countByActorIdAndTypeAndStatus(UUID actorId, JobType type, JobStatus status);

    @Query("""
            SELECT j.status AS status, COUNT(j) AS jobCount
            FROM Job j
            GROUP BY j.status
            """)
    List<StatusCount> countByStatus();

    @Query("""
            SELECT j.priority AS priority, COUNT(j) AS jobCount
            FROM Job j
            WHERE j.status = :status
            GROUP BY j.priority
            ORDER BY j.priority ASC
            """)
    List<PriorityCount> countByPriorityForStatus(@Param("status") JobStatus status);

    long countByStatusAndCompletedAtGreaterThanEqual(JobStatus status, OffsetDateTime since);

    long countByStatusAndFailedAtGreaterThanEqual(JobStatus status, OffsetDateTime since);

    long countByCreatedAtGreaterThanEqual(OffsetDateTime since);

    long countByStatusAndCreatedAtGreaterThanEqual(JobStatus status, OffsetDateTime since);

    @Query("""
            SELECT AVG(j.durationMs) FROM Job j
            WHERE j.status = :status
              AND j.completedAt >= :since
              AND j.durationMs IS NOT NULL
            """)
    Double averageDurationMs(@Param("status") JobStatus status, @Param("since") OffsetDateTime since);

    @Query("""
            SELECT COUNT(j) FROM Job j
            WHERE j.status = :processing
              AND COALESCE(j.lastProgressAt, j.startedAt) < :threshold
            """)
    long countStuck(@Param("processing") JobStatus processing, @Param("threshold") OffsetDateTime threshold);

    @Query("""
            SELECT j FROM Job j
            WHERE j.status = :processing
              AND COALESCE(j.lastProgressAt, j.startedAt) < :threshold
            ORDER BY j.startedAt ASC
            """)
    List<Job> findStuck(
            @Param("processing") JobStatus processing,
            @Param("threshold") OffsetDateTime threshold,
            Pageable pageable);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.progressPercent = :percent,
                j.currentStep = :step,
                j.stepsCompleted = :stepsCompleted,
                j.totalSteps = :totalSteps,
                j.lastProgressAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.workerId = :workerId
            """)
    int updateProgress(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("percent") int percent,
            @Param("step") String step,
            @Param("stepsCompleted") int stepsCompleted,
            @Param("totalSteps") int totalSteps,
            @Param("now") OffsetDateTime now,
            @Param("processing") JobStatus processing);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.status = :cancelled,
                j.cancelledAt = :now,
                j.updatedAt = :now,
                j.workerId = NULL,
                j.claimedAt = NULL
            WHERE j.id = :id
              AND j.status IN :cancellable
            """)
    int markCancelled(
            @Param("id") UUID id,
            @Param("now") OffsetDateTime now,
            @Param("cancelled") JobStatus cancelled,
            @Param("cancellable") Collection<JobStatus> cancellable);

    /**
     * Returns a stuck job to the queue. The heartbeat comparison keeps a job that reported
     * progress after it was read from being requeued.
     */
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.status = :pending,
                j.retryCount = :nextRetryCount,
                j.retryAfter = :retryAfter,
                j.errorCode = :errorCode,
                j.errorMessage = :errorMessage,
                j.workerId = NULL,
                j.claimedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.workerId = :workerId
              AND j.retryCount = :expectedRetryCount
              AND COALESCE(j.lastProgressAt, j.startedAt) < :threshold
            """)
    int requeueStuck(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("nextRetryCount") int nextRetryCount,
            @Param("retryAfter") OffsetDateTime retryAfter,
            @Param("errorCode") String errorCode,
            @Param("errorMessage") String errorMessage,
            @Param("threshold") OffsetDateTime threshold,
            @Param("now") OffsetDateTime now,
            @Param("pending") JobStatus pending,
            @Param("processing") JobStatus processing);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.status = :failed,
                j.failedAt = :now,
                j.errorCode = :errorCode,
                j.errorMessage = :errorMessage,
                j.workerId = NULL,
                j.claimedAt = NULL,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.status = :processing
              AND j.workerId = :workerId
              AND j.retryCount = :expectedRetryCount
              AND COALESCE(j.lastProgressAt, j.startedAt) < :threshold
            """)
    int failStuck(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("expectedRetryCount") int expectedRetryCount,
            @Param("errorCode") String errorCode,
            @Param("errorMessage") String errorMessage,
            @Param("threshold") OffsetDateTime threshold,
            @Param("now") OffsetDateTime now,
            @Param("failed") JobStatus failed,
            @Param("processing") JobStatus processing);

    @Modifying
    @Transactional
    int deleteByStatusAndCompletedAtBefore(JobStatus status, OffsetDateTime completedAt);

    @Modifying
    @Transactional
    int deleteByStatusAndFailedAtBefore(JobStatus status, OffsetDateTime failedAt);

    @Modifying
    @Transactional
    int deleteByStatusAndCancelledAtBefore(JobStatus status, OffsetDateTime cancelledAt);
}
