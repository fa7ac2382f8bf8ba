package com.skillq.subject;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface HaulRecordRepository extends JpaRepository<HaulRecord, UUID> {

    List<HaulRecord> findByProjectIdOrderByHaulDateAsc(UUID projectId);
}
