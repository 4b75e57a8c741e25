package com.purchasingpower.crewflow.agent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by the generation loop and the provider adapter.
 * A child signal is cancelled when either it or its parent is.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CancellationSignal parent;

    public CancellationSignal() {
        this(null);
    }

    private CancellationSignal(CancellationSignal parent) {
        this.parent = parent;
    }

    public CancellationSignal child() {
        return new CancellationSignal(this);
    }

    /**
     * @return true if this call cancelled the signal
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
