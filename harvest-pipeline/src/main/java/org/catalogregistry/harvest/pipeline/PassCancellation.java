package org.catalogregistry.harvest.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

import org.catalogregistry.harvest.pipeline.errors.PassCancelledException;

/**
 * Cooperative cancellation flag, checked by the orchestrator before each record.
 */
public class PassCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static PassCancellation none() {
        return new PassCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void checkpoint(String source) throws PassCancelledException {
        if (cancelled.get()) {
            throw new PassCancelledException("Pass of " + source + " was cancelled");
        }
    }
}
