package org.janelia.fuzzer.engine;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared flag used to stop an in-progress sweep (e.g. from a shutdown hook).
 * Once cancelled, a token stays cancelled.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled;

    public CancellationToken() {
        this.cancelled = new AtomicBoolean(false);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(final String context)
            throws CancellationException {
        if (isCancelled()) {
            throw new CancellationException(context + " was cancelled");
        }
    }
}
