package com.photonize.core.export;

import com.photonize.core.fs.ImageFiles;
import com.photonize.core.model.PhotoEntry;
import com.photonize.core.work.CancellationSignal;
import com.photonize.core.work.WorkerPool;
import com.photonize.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends photos through a {@link PhotoUpscaler} into {@code <directory>/Upscaled/}.
 * Folder entries are expanded to the images directly inside them.
 */
public final class UpscaleService {
    private static final Logger LOGGER = AppLogger.get();

    public static final String OUTPUT_FOLDER = "Upscaled";

    private final PhotoUpscaler upscaler;
    private final int workerCount;
    private final Duration staggerDelay;

    public UpscaleService(PhotoUpscaler upscaler) {
        this(upscaler, 1, Duration.ZERO);
    }

    public UpscaleService(PhotoUpscaler upscaler, int workerCount, Duration staggerDelay) {
        if (upscaler == null) {
            throw new IllegalArgumentException("upscaler is required");
        }
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be greater than zero: " + workerCount);
        }
        this.upscaler = upscaler;
        this.workerCount = workerCount;
        this.staggerDelay = staggerDelay == null ? Duration.ZERO : staggerDelay;
    }

    public ExportResult upscale(List<PhotoEntry> items,
                                Path directory,
                                Function<List<String>, OverwriteDecision> overwrite,
                                ExportProgress progress) {
        return upscale(items, directory, overwrite, progress, CancellationSignal.none());
    }

    public ExportResult upscale(List<PhotoEntry> items,
                                Path directory,
                                Function<List<String>, OverwriteDecision> overwrite,
                                ExportProgress progress,
                                CancellationSignal signal) {
        if (items == null || items.isEmpty()) {
            return ExportResult.failed("No photos to upscale.");
        }
        if (directory == null || !Files.isDirectory(directory)) {
            return ExportResult.failed("Invalid directory path.");
        }
        if (!upscaler.isAvailable()) {
            return ExportResult.failed("Upscaler not found at: " + upscaler.location());
        }

        List<Path> inputs;
        try {
            inputs = expand(items);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Cannot list folder for upscaling", ex);
            return ExportResult.failed("Cannot read folder: " + ex.getMessage());
        }
        if (inputs.isEmpty()) {
            return ExportResult.failed("No image files found to upscale.");
        }

        Path outputFolder = directory.resolve(OUTPUT_FOLDER);
        try {
            Files.createDirectories(outputFolder);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Cannot create upscale folder " + outputFolder, ex);
            return ExportResult.failed("Cannot create output folder: " + ex.getMessage());
        }

        List<String> existing = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.exists(outputFolder.resolve(input.getFileName()))) {
                existing.add(input.getFileName().toString());
            }
        }
        OverwriteDecision decision = OverwriteDecision.OVERWRITE_ALL;
        if (!existing.isEmpty() && overwrite != null) {
            decision = overwrite.apply(List.copyOf(existing));
        }
        if (decision == OverwriteDecision.CANCEL) {
            return ExportResult.failed("Upscale cancelled by user.");
        }

        ExportProgress sink = progress == null ? ExportProgress.NONE : progress;
        int total = inputs.size();
        AtomicInteger done = new AtomicInteger();
        AtomicInteger upscaled = new AtomicInteger();
        List<String> failures = Collections.synchronizedList(new ArrayList<>());
        int skipped = 0;

        WorkerPool.Listener<Path> listener = new WorkerPool.Listener<>() {
            @Override
            public void onCompleted(Path input) {
                upscaled.incrementAndGet();
                sink.report(done.incrementAndGet(), total, "Upscaled " + input.getFileName());
            }

            @Override
            public void onFailed(Path input, Throwable error) {
                failures.add(input.getFileName() + ": " + ImageExporter.describe(error));
                sink.report(done.incrementAndGet(), total, "Failed " + input.getFileName());
            }
        };

        try (WorkerPool<Path> pool = new WorkerPool<>("upscale", Math.min(workerCount, total), staggerDelay, listener)) {
            for (Path input : inputs) {
                if (decision == OverwriteDecision.SKIP_EXISTING && existing.contains(input.getFileName().toString())) {
                    skipped++;
                    sink.report(done.incrementAndGet(), total, "Skipped " + input.getFileName());
                    continue;
                }
                if (decision == OverwriteDecision.OVERWRITE_ALL) {
                    Files.deleteIfExists(outputFolder.resolve(input.getFileName()));
                }
                pool.submit(input, (path, cancel) -> {
                    UpscaleOutcome outcome = upscaler.upscale(path, outputFolder, cancel);
                    if (!outcome.success()) {
                        throw new IOException(outcome.detail());
                    }
                }, signal);
            }
            pool.drain();
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Cannot replace existing upscaled file", ex);
            return ExportResult.failed("Cannot replace existing file: " + ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ExportResult.failed("Upscale interrupted.");
        }

        LOGGER.info(() -> "Upscale: " + upscaled.get() + " of " + total + " done, " + failures.size() + " failed");
        return ExportResult.summarize("Upscale", "upscaled", "with " + upscaler.location(),
                upscaled.get(), skipped, new ArrayList<>(failures), total, outputFolder);
    }

    static List<Path> expand(List<PhotoEntry> items) throws IOException {
        Set<Path> inputs = new LinkedHashSet<>();
        for (PhotoEntry item : items) {
            if (item.isContainer()) {
                inputs.addAll(ImageFiles.listImageFiles(item.getPath()));
            } else {
                inputs.add(item.getPath());
            }
        }
        return new ArrayList<>(inputs);
    }
}
