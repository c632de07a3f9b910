package com.crossreview.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to every task invocation.
 * <p>
 * Cancelling is one-way and idempotent. Callbacks registered after cancellation run immediately.
 * Runners check {@link #isCancelled()} opportunistically; an already-dispatched external call may
 * still complete.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable callback : callbacks) {
                runSafely(callback);
            }
            callbacks.clear();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runSafely(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Creates a token that is cancelled whenever this one is, but can also be cancelled on its own.
     * Callers must {@link Registration#unregister()} the returned link once the child is done.
     */
    public Linked child() {
        var child = new CancellationToken();
        Registration link = onCancel(child::cancel);
        return new Linked(child, link);
    }

    private static void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    @FunctionalInterface
    public interface Registration {
        void unregister();
    }

    public record Linked(CancellationToken token, Registration link) {}
}
