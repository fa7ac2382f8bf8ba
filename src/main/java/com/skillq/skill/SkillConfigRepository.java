package com.skillq.skill;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SkillConfigRepository extends JpaRepository<SkillConfigEntity, UUID> {

    Optional<SkillConfigEntity> findBySkillName(String skillName);

    @Modifying
    @Transactional
    @Query("UPDATE SkillConfigEntity c SET c.lastValidated = :now WHERE c.skillName = :skillName")
    int markValidated(@Param("skillName") String skillName, @Param("now") OffsetDateTime now);
}
