package com.skillq.skill;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "skillq_skill_configs")
public class SkillConfigEntity {

    @Id
    private UUID id;

    @Column(name = "skill_name", nullable = false, unique = true)
    private String skillName;

    @Column(name = "skill_version", nullable = false)
    private String skillVersion;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "conversion_rates", columnDefinition = "jsonb", nullable = false)
    private JsonNode conversionRates;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private JsonNode thresholds;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "last_validated")
    private OffsetDateTime lastValidated;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public SkillConfigEntity() {
    }

    public SkillConfigEntity(UUID id, String skillName, String skillVersion, JsonNode conversionRates,
            JsonNode thresholds) {
        this.id = id;
        this.skillName = skillName;
        this.skillVersion = skillVersion;
        this.conversionRates = conversionRates;
        this.thresholds = thresholds;
        this.updatedAt = OffsetDateTime.now();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getSkillName() {
        return skillName;
    }

    public void setSkillName(String skillName) {
        this.skillName = skillName;
    }

    public String getSkillVersion() {
        return skillVersion;
    }

    public void setSkillVersion(String skillVersion) {
        this.skillVersion = skillVersion;
    }

    public JsonNode getConversionRates() {
        return conversionRates;
    }

    public void setConversionRates(JsonNode conversionRates) {
        this.conversionRates = conversionRates;
    }

    public JsonNode getThresholds() {
        return thresholds;
    }

    public void setThresholds(JsonNode thresholds) {
        this.thresholds = thresholds;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public OffsetDateTime getLastValidated() {
        return lastValidated;
    }

    public void setLastValidated(OffsetDateTime lastValidated) {
        this.lastValidated = lastValidated;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
