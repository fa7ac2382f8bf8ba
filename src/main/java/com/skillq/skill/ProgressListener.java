package com.skillq.skill;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = update -> {
    };

    void onProgress(ProgressUpdate update);
}
