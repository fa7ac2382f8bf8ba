package com.skillq.skill;

/**
 * A named domain algorithm behind the uniform execute/validate contract.
 *
 * @param <T> result data produced on success
 */
public interface Skill<T> {

    String name();

    String version();

    String description();

    /**
     * Fast precondition check. Must not perform I/O beyond what the context already holds.
     */
    ValidationResult validate(SkillContext context);

    /**
     * Runs the skill. Never throws: every failure is reported through {@link SkillResult#error()}.
     */
    SkillResult<T> execute(SkillContext context);
}
