package com.ecolityper.core.state;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Set once by the interrupt path, polled by the scheduler.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** @return true if this call cancelled the token, false if it was already cancelled */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
