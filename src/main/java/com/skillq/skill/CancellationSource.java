package com.skillq.skill;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process cancellation flag.
 */
public class CancellationSource implements CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
