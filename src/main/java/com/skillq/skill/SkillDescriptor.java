package com.skillq.skill;

public record SkillDescriptor(String name, String version, String description) {

    public static SkillDescriptor of(Skill<?> skill) {
        return new SkillDescriptor(skill.name(), skill.version(), skill.description());
    }
}
