package im.arun.codex.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation, checked between batch items only.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
