package com.skillq.subject;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One compactor pickup.
 */
@Entity
@Table(name = "haul_log")
public class HaulRecord {

    @Id
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "haul_date", nullable = false)
    private LocalDate haulDate;

    @Column(nullable = false)
    private BigDecimal tonnage;

    @Column(name = "days_since_last")
    private Integer daysSinceLast;

    public HaulRecord() {
    }

    public HaulRecord(UUID id, UUID projectId, LocalDate haulDate, BigDecimal tonnage) {
        this.id = id;
        this.projectId = projectId;
        this.haulDate = haulDate;
        this.tonnage = tonnage;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public void setProjectId(UUID projectId) {
        this.projectId = projectId;
    }

    public LocalDate getHaulDate() {
        return haulDate;
    }

    public void setHaulDate(LocalDate haulDate) {
        this.haulDate = haulDate;
    }

    public BigDecimal getTonnage() {
        return tonnage;
    }

    public void setTonnage(BigDecimal tonnage) {
        this.tonnage = tonnage;
    }

    public Integer getDaysSinceLast() {
        return daysSinceLast;
    }

    public void setDaysSinceLast(Integer daysSinceLast) {
        this.daysSinceLast = daysSinceLast;
    }
}
