package com.photonize.core.work;

/**
 * Unit of work run by a {@link WorkerPool} worker for one payload.
 * Implementations should check {@code signal} between blocking steps; the worker thread is also
 * interrupted when the signal fires.
 */
@FunctionalInterface
public interface WorkAction<T> {
    void run(T payload, CancellationSignal signal) throws Exception;
}
