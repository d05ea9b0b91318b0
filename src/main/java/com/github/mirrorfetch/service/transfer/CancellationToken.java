package com.github.mirrorfetch.service.transfer;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation shared by a batch and all of its transfers.
 * <p>
 * Transfers poll {@link #isCancelled()} at chunk boundaries. Hooks registered with
 * {@link #onCancel(Runnable)} run once on cancellation, which lets a blocked HTTP call
 * be aborted instead of waiting for its read timeout.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final Set<Runnable> hooks = ConcurrentHashMap.newKeySet();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Request cancellation. Idempotent.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        cancelledLatch.countDown();
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation hook failed: {}", e.getMessage(), e);
            }
        }
        hooks.clear();
    }

    /**
     * Register a hook; runs immediately if already cancelled.
     */
    public void onCancel(Runnable hook) {
        hooks.add(hook);
        if (cancelled.get() && hooks.remove(hook)) {
            hook.run();
        }
    }

    public void removeHook(Runnable hook) {
        hooks.remove(hook);
    }

    /**
     * Sleep for the given delay unless cancelled first.
     *
     * @return true if the full delay elapsed, false if cancelled or interrupted
     */
    public boolean sleep(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return !isCancelled();
        }
        try {
            return !cancelledLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
