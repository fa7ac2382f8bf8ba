package com.skillq.alert;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface JobAlertRepository extends JpaRepository<JobAlert, UUID> {

    List<JobAlert> findByJobIdOrderByCreatedAtAsc(UUID jobId);

    boolean existsByTypeAndResolvedAtIsNullAndCreatedAtGreaterThanEqual(AlertType type, OffsetDateTime since);

    List<JobAlert> findByResolvedAtIsNullOrderByCreatedAtDesc();
}
