package com.photonize.core.work;

import com.photonize.logging.AppLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative, one-way cancellation flag handed to every {@link WorkAction}.
 * Once cancelled it stays cancelled; callbacks registered after that run immediately.
 */
public final class CancellationSignal {
    private static final Logger LOGGER = AppLogger.get();

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    /**
     * Handle returned by {@link #onCancel(Runnable)}; closing it unregisters the callback.
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * A fresh signal that nobody else holds, so it is never cancelled unless the receiver does it.
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
            lock.notifyAll();
        }
        for (Runnable callback : toRun) {
            runQuietly(callback);
        }
    }

    public boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    public Registration onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback is required");
        }
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runQuietly(callback);
        return () -> {
        };
    }

    /**
     * Waits for {@code duration} unless cancelled first.
     *
     * @throws CancellationException if the signal is or becomes cancelled while waiting
     */
    public void sleep(Duration duration) throws InterruptedException {
        long remaining = duration == null ? 0 : duration.toNanos();
        long deadline = System.nanoTime() + remaining;
        synchronized (lock) {
            while (!cancelled && remaining > 0) {
                TimeUnit.NANOSECONDS.timedWait(lock, remaining);
                remaining = deadline - System.nanoTime();
            }
            if (cancelled) {
                throw new CancellationException("Operation cancelled");
            }
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Cancellation callback failed", ex);
        }
    }
}
