package com.photonize.core.work;

/**
 * Thrown by {@link WorkerPool#submit} once the pool has begun shutting down.
 */
public class PoolClosedException extends IllegalStateException {
    public PoolClosedException(String message) {
        super(message);
    }
}
