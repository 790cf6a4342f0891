package com.photonize.core.work;

import com.photonize.logging.AppLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of worker threads pulling {@link WorkAction}s from one FIFO queue.
 * <p>
 * Every submitted item is reported exactly once, either through {@link Listener#onCompleted} or
 * {@link Listener#onFailed}, from the worker thread that ran it (or from the thread calling
 * {@link #close()} for items that never started). A failing action never stops its worker, even
 * when it throws an {@link Error}. An action that observes its cancelled signal but returns normally
 * is reported as completed; only a throw counts as a failure.
 * Listeners run on worker threads; callers that own UI-bound state should route results through a
 * {@link CompletionInbox} and apply them on their own thread.
 * <p>
 * Lifecycle: {@code RUNNING -> DRAINING} on {@link #shutdown()}, then {@code STOPPED} on
 * {@link #close()}. Both transitions are idempotent.
 */
public final class WorkerPool<T> implements AutoCloseable {
    private static final Logger LOGGER = AppLogger.get();

    private static final long IDLE_POLL_MILLIS = 50;
    private static final Duration DEFAULT_CLOSE_GRACE = Duration.ofSeconds(5);

    /**
     * Completion callbacks. Both default to no-ops.
     */
    public interface Listener<T> {
        default void onCompleted(T payload) {
        }

        default void onFailed(T payload, Throwable error) {
        }
    }

    enum State { RUNNING, DRAINING, STOPPED }

    private final String name;
    private final Duration staggerDelay;
    private final Duration closeGracePeriod;
    private final Listener<? super T> listener;
    private final BlockingQueue<WorkItem<T>> queue = new LinkedBlockingQueue<>();
    private final List<Thread> workers;
    private final CancellationSignal poolSignal = new CancellationSignal();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Object lifecycleLock = new Object();
    private final Object pendingLock = new Object();
    private volatile State state = State.RUNNING;
    private int pending;

    public WorkerPool(int workerCount) {
        this("worker-pool", workerCount, Duration.ZERO, null);
    }

    public WorkerPool(int workerCount, Duration staggerDelay) {
        this("worker-pool", workerCount, staggerDelay, null);
    }

    public WorkerPool(String name, int workerCount, Duration staggerDelay, Listener<? super T> listener) {
        this(name, workerCount, staggerDelay, DEFAULT_CLOSE_GRACE, listener);
    }

    /**
     * @param workerCount      number of threads, must be positive
     * @param staggerDelay     extra start-up wait per worker slot; slot {@code i} waits {@code i * staggerDelay}
     *                         once, before taking its first item
     * @param closeGracePeriod how long {@link #close()} waits for workers to exit in total
     * @throws IllegalArgumentException if {@code workerCount <= 0} or a duration is negative
     */
    public WorkerPool(String name,
                      int workerCount,
                      Duration staggerDelay,
                      Duration closeGracePeriod,
                      Listener<? super T> listener) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be greater than zero: " + workerCount);
        }
        if (staggerDelay != null && staggerDelay.isNegative()) {
            throw new IllegalArgumentException("Stagger delay must not be negative: " + staggerDelay);
        }
        if (closeGracePeriod != null && closeGracePeriod.isNegative()) {
            throw new IllegalArgumentException("Close grace period must not be negative: " + closeGracePeriod);
        }
        this.name = (name == null || name.isBlank()) ? "worker-pool" : name;
        this.staggerDelay = staggerDelay == null ? Duration.ZERO : staggerDelay;
        this.closeGracePeriod = closeGracePeriod == null ? DEFAULT_CLOSE_GRACE : closeGracePeriod;
        this.listener = listener == null ? new Listener<T>() { } : listener;
        this.workers = new ArrayList<>(workerCount);
        for (int slot = 0; slot < workerCount; slot++) {
            final int workerSlot = slot;
            Thread worker = new Thread(() -> runWorker(workerSlot), this.name + "-worker-" + slot);
            worker.setDaemon(true);
            workers.add(worker);
        }
        workers.forEach(Thread::start);
    }

    public CompletableFuture<T> submit(T payload, WorkAction<? super T> action) {
        return submit(payload, action, null);
    }

    /**
     * Queues {@code action} for {@code payload}. The returned future completes with the payload, or
     * exceptionally with the same error passed to {@link Listener#onFailed}. Cancelling the future
     * has no effect on the item; use {@code signal} for that.
     *
     * @throws IllegalArgumentException if payload or action is null
     * @throws PoolClosedException      after {@link #shutdown()} or {@link #close()}
     */
    public CompletableFuture<T> submit(T payload, WorkAction<? super T> action, CancellationSignal signal) {
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        WorkItem<T> item = new WorkItem<>(payload, action, signal == null ? CancellationSignal.none() : signal);
        synchronized (lifecycleLock) {
            if (state != State.RUNNING) {
                throw new PoolClosedException(name + " is " + state.name().toLowerCase() + " and accepts no new work");
            }
            synchronized (pendingLock) {
                pending++;
            }
            queue.add(item);
        }
        return item.future;
    }

    /**
     * Queued plus in-flight items. Racy by nature; meant for progress display.
     */
    public int pendingCount() {
        synchronized (pendingLock) {
            return pending;
        }
    }

    public int workerCount() {
        return workers.size();
    }

    public boolean isAcceptingWork() {
        return state == State.RUNNING;
    }

    public boolean drain() throws InterruptedException {
        return drain(null);
    }

    /**
     * Blocks until every submitted item has been reported, or until {@code timeout} elapses.
     * New submissions stay allowed and nothing is interrupted.
     *
     * @return {@code true} if the pool went idle in time
     */
    public boolean drain(Duration timeout) throws InterruptedException {
        synchronized (pendingLock) {
            if (timeout == null) {
                while (pending > 0) {
                    pendingLock.wait();
                }
                return true;
            }
            long remaining = timeout.toNanos();
            long deadline = System.nanoTime() + remaining;
            while (pending > 0) {
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(pendingLock, remaining);
                remaining = deadline - System.nanoTime();
            }
            return true;
        }
    }

    /**
     * Stops accepting work, lets the queue run dry, and waits for every worker to exit.
     */
    public void shutdown() throws InterruptedException {
        synchronized (lifecycleLock) {
            if (state == State.RUNNING) {
                state = State.DRAINING;
                LOGGER.fine(() -> name + " draining " + pendingCount() + " item(s)");
            }
        }
        for (Thread worker : workers) {
            if (worker != Thread.currentThread()) {
                worker.join();
            }
        }
    }

    /**
     * Stops immediately: in-flight items see their signal cancelled (and their thread interrupted),
     * queued items are reported as cancelled without running, and workers are joined for at most
     * the close grace period. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (lifecycleLock) {
            state = State.STOPPED;
        }
        poolSignal.cancel();

        List<WorkItem<T>> abandoned = new ArrayList<>();
        queue.drainTo(abandoned);
        for (WorkItem<T> item : abandoned) {
            report(item, new CancellationException(name + " closed before the item started"));
        }

        long deadline = System.nanoTime() + closeGracePeriod.toNanos();
        boolean interrupted = false;
        for (Thread worker : workers) {
            if (worker == Thread.currentThread()) {
                continue;
            }
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                if (remainingMillis > 0) {
                    worker.join(remainingMillis);
                }
            } catch (InterruptedException ex) {
                interrupted = true;
            }
            if (worker.isAlive()) {
                LOGGER.warning(() -> worker.getName() + " did not stop within " + closeGracePeriod);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void runWorker(int slot) {
        if (!awaitStaggeredStart(slot)) {
            return;
        }
        while (true) {
            WorkItem<T> item;
            try {
                item = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                // a late cancellation callback may land here; only STOPPED ends the loop
                if (state == State.STOPPED) {
                    return;
                }
                continue;
            }
            if (item == null) {
                if (state != State.RUNNING && queue.isEmpty()) {
                    return;
                }
                continue;
            }
            if (state == State.STOPPED) {
                report(item, new CancellationException(name + " closed before the item started"));
                continue;
            }
            execute(item);
        }
    }

    private boolean awaitStaggeredStart(int slot) {
        if (slot == 0 || staggerDelay.isZero()) {
            return true;
        }
        try {
            poolSignal.sleep(staggerDelay.multipliedBy(slot));
            return true;
        } catch (CancellationException ex) {
            return false;
        } catch (InterruptedException ex) {
            return state != State.STOPPED;
        }
    }

    private void execute(WorkItem<T> item) {
        CancellationSignal effective = new CancellationSignal();
        InFlight inFlight = new InFlight(Thread.currentThread());
        CancellationSignal.Registration interrupter = effective.onCancel(inFlight::interrupt);
        CancellationSignal.Registration fromItem = item.signal.onCancel(effective::cancel);
        CancellationSignal.Registration fromPool = poolSignal.onCancel(effective::cancel);

        Throwable failure = null;
        try {
            if (effective.isCancelled()) {
                failure = new CancellationException("Cancelled before start: " + item.payload);
            } else {
                item.action.run(item.payload, effective);
            }
        } catch (Throwable ex) {
            failure = ex;
        } finally {
            inFlight.finish();
            fromPool.close();
            fromItem.close();
            interrupter.close();
            Thread.interrupted();
        }

        if (failure != null && effective.isCancelled() && !(failure instanceof CancellationException)) {
            CancellationException cancelled = new CancellationException("Cancelled: " + item.payload);
            cancelled.initCause(failure);
            failure = cancelled;
        }
        report(item, failure);
    }

    private void report(WorkItem<T> item, Throwable failure) {
        try {
            if (failure == null) {
                listener.onCompleted(item.payload);
            } else {
                LOGGER.log(Level.FINE, name + " item failed: " + item.payload, failure);
                listener.onFailed(item.payload, failure);
            }
        } catch (Throwable ex) {
            LOGGER.log(Level.WARNING, name + " listener threw for " + item.payload, ex);
        } finally {
            if (failure == null) {
                item.future.complete(item.payload);
            } else {
                item.future.completeExceptionally(failure);
            }
            synchronized (pendingLock) {
                pending--;
                if (pending == 0) {
                    pendingLock.notifyAll();
                }
            }
        }
    }

    private static final class WorkItem<T> {
        private final T payload;
        private final WorkAction<? super T> action;
        private final CancellationSignal signal;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private WorkItem(T payload, WorkAction<? super T> action, CancellationSignal signal) {
            this.payload = payload;
            this.action = action;
            this.signal = signal;
        }
    }

    /**
     * Interrupts the worker only while it is still running the item that was cancelled.
     */
    private static final class InFlight {
        private final Thread thread;
        private boolean active = true;

        private InFlight(Thread thread) {
            this.thread = thread;
        }

        synchronized void interrupt() {
            if (active) {
                thread.interrupt();
            }
        }

        synchronized void finish() {
            active = false;
        }
    }
}
