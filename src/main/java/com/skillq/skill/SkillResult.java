package com.skillq.skill;

import com.skillq.error.CancelledException;

/**
 * Uniform outcome of a skill execution. Exactly one of {@code data} and {@code error} is set.
 */
public record SkillResult<T>(boolean success, T data, SkillError error, SkillMetadata metadata) {

    public static <T> SkillResult<T> success(T data, SkillMetadata metadata) {
        return new SkillResult<>(true, data, null, metadata);
    }

    public static <T> SkillResult<T> failure(SkillError error, SkillMetadata metadata) {
        return new SkillResult<>(false, null, error, metadata);
    }

    public boolean isCancelled() {
        return !success && error != null && CancelledException.CODE.equals(error.code());
    }
}
