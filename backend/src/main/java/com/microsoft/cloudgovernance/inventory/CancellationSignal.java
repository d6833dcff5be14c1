package com.microsoft.cloudgovernance.inventory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by a pipeline and its workers.
 */
public final class CancellationSignal {

    /** A signal that is never cancelled. */
    public static final CancellationSignal NONE = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        if (this == NONE) {
            return;
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
