package com.agilab.log_collecting.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sticky cancellation flag shared between a worker and whoever may stop it.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void reset() {
        cancelled.set(false);
    }
}
