package com.delta.autoapply.apply.flow;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through every pacing sleep and page check of a flow.
 */
public final class CancellationSignal {
    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * A signal that never reports cancellation.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ApplicationCancelledException("Flow cancelled");
        }
    }
}
