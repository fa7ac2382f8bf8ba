package com.skillq.skill;

public record ProgressUpdate(int percent, String step, int stepNumber, int totalSteps) {

    public ProgressUpdate {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be between 0 and 100, got " + percent);
        }
    }

    public static ProgressUpdate of(int percent, String step) {
        return new ProgressUpdate(percent, step, 0, 0);
    }
}
