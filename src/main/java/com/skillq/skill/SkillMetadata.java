package com.skillq.skill;

import java.time.OffsetDateTime;

public record SkillMetadata(
        String skillName,
        String skillVersion,
        long durationMs,
        OffsetDateTime executedAt,
        ResourceUsage resourceUsage) {
}
