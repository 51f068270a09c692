package io.logtriage.runtime;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation token for one run. The first reason wins; later calls are ignored.
 */
public final class RunCancellation {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel(String why) {
        reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
