package com.phillippitts.webpbatch.service.run;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set-once cancellation flag shared between the caller and the run worker.
 *
 * <p>Once cancelled the token stays cancelled. The worker only polls it at its checkpoints;
 * an encoder process or archive write in flight is never interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call set the flag, {@code false} if it was already set
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
