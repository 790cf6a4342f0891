package com.photonize.core.thumbnail;

import com.photonize.config.ConfigService;
import com.photonize.core.model.PhotoEntry;
import com.photonize.core.work.CancellationSignal;
import com.photonize.core.work.CompletionInbox;
import com.photonize.core.work.WorkOutcome;
import com.photonize.core.work.WorkerPool;
import com.photonize.logging.AppLogger;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * Decodes thumbnails in the background and applies them on the caller's thread.
 * <p>
 * {@link #request} may be called from the owning thread at any time; decoded images are held
 * back until that thread calls {@link #applyCompleted()}.
 */
public final class ThumbnailLoader implements AutoCloseable {
    private static final Logger LOGGER = AppLogger.get();

    private final ThumbnailDecoder decoder;
    private final int maxDimension;
    private final CompletionInbox<ThumbnailJob> inbox = new CompletionInbox<>();
    private final WorkerPool<ThumbnailJob> pool;

    public ThumbnailLoader(ThumbnailDecoder decoder, int maxDimension, int workerCount, Duration staggerDelay) {
        if (decoder == null) {
            throw new IllegalArgumentException("decoder is required");
        }
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
        }
        this.decoder = decoder;
        this.maxDimension = maxDimension;
        this.pool = new WorkerPool<>("thumbnails", workerCount, staggerDelay, inbox);
    }

    public static ThumbnailLoader fromConfig(ConfigService config, ThumbnailDecoder decoder) {
        return new ThumbnailLoader(decoder, config.getThumbnailSize(), config.getWorkerCount(), config.getStaggerDelay());
    }

    /**
     * Queues a decode for every photo in {@code entries}; folders are skipped.
     *
     * @return number of decodes queued
     */
    public int request(List<PhotoEntry> entries) {
        int queued = 0;
        for (PhotoEntry entry : entries) {
            if (!entry.isContainer()) {
                request(entry, null);
                queued++;
            }
        }
        return queued;
    }

    public CompletableFuture<PhotoEntry> request(PhotoEntry entry, CancellationSignal signal) {
        ThumbnailJob job = new ThumbnailJob(entry, entry.getPath());
        return pool.submit(job, this::decode, signal).thenApply(ThumbnailJob::entry);
    }

    /**
     * Applies every finished decode to its entry. Call from the thread that owns the entries.
     *
     * @return number of thumbnails set
     */
    public int applyCompleted() {
        int[] applied = {0};
        inbox.drainTo(outcome -> {
            if (apply(outcome)) {
                applied[0]++;
            }
        });
        return applied[0];
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return pool.drain(timeout);
    }

    public int pendingCount() {
        return pool.pendingCount();
    }

    @Override
    public void close() {
        pool.close();
    }

    private void decode(ThumbnailJob job, CancellationSignal signal) throws Exception {
        signal.throwIfCancelled();
        CompletableFuture<BufferedImage> future = decoder.decode(job.path(), maxDimension);
        try {
            job.image = future.get();
        } catch (InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw ex;
        }
    }

    private static boolean apply(WorkOutcome<ThumbnailJob> outcome) {
        ThumbnailJob job = outcome.payload();
        if (!outcome.succeeded()) {
            LOGGER.warning(() -> "Thumbnail failed for " + job.path().getFileName() + ": "
                + outcome.error().getMessage());
            return false;
        }
        job.entry().setThumbnail(job.image);
        return true;
    }

    private static final class ThumbnailJob {
        private final PhotoEntry entry;
        private final Path path;
        private volatile BufferedImage image;

        private ThumbnailJob(PhotoEntry entry, Path path) {
            this.entry = entry;
            this.path = path;
        }

        PhotoEntry entry() {
            return entry;
        }

        Path path() {
            return path;
        }

        @Override
        public String toString() {
            return String.valueOf(path.getFileName());
        }
    }
}
