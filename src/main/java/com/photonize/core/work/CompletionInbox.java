package com.photonize.core.work;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Collects worker callbacks so the thread that owns the photo collection can apply them itself.
 * Workers only enqueue; {@link #drainTo(Consumer)} is meant to be called from the owning thread.
 */
public final class CompletionInbox<T> implements WorkerPool.Listener<T> {
    private final Queue<WorkOutcome<T>> outcomes = new ConcurrentLinkedQueue<>();

    @Override
    public void onCompleted(T payload) {
        outcomes.add(WorkOutcome.completed(payload));
    }

    @Override
    public void onFailed(T payload, Throwable error) {
        outcomes.add(WorkOutcome.failed(payload, error));
    }

    public int drainTo(Consumer<? super WorkOutcome<T>> sink) {
        int drained = 0;
        WorkOutcome<T> outcome;
        while ((outcome = outcomes.poll()) != null) {
            sink.accept(outcome);
            drained++;
        }
        return drained;
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }
}
