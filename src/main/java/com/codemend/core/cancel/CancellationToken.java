package com.codemend.core.cancel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a request and every suspension
 * point it passes through (generation calls, diagnostic polls, retry sleeps,
 * confirmation prompts).
 *
 * Cancellation is one-way: once requested it stays requested.
 * Listeners registered after cancellation run immediately.
 */
public class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Object sleepLock = new Object();

    /** A token that is never cancelled by anyone holding it. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared NONE token cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            synchronized (sleepLock) {
                sleepLock.notifyAll();
            }
            for (Runnable listener : listeners) {
                listener.run();
            }
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new OperationCancelledException();
        }
    }

    /**
     * Runs the listener when cancellation is requested. Used by the command
     * runner to kill a child process.
     */
    public void onCancellationRequested(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get()) {
            listener.run();
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }

    /**
     * Sleeps for the given duration or until cancelled, whichever comes first.
     *
     * @return true if the full duration elapsed, false if woken by cancellation
     */
    public boolean sleep(long millis) {
        if (millis <= 0) {
            return !cancelled.get();
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        synchronized (sleepLock) {
            while (!cancelled.get()) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    return true;
                }
                try {
                    sleepLock.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new OperationCancelledException("Interrupted while waiting", e);
                }
            }
        }
        return false;
    }
}
