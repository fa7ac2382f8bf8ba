package com.skillq.skill;

import com.skillq.error.CancelledException;

/**
 * Cooperative cancellation signal. Skills poll it at checkpoints; nothing is ever interrupted.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancelledException("Execution was cancelled");
        }
    }
}
