package com.photonize.core.export;

import com.photonize.config.ConfigService;
import com.photonize.core.model.PhotoEntry;
import com.photonize.core.work.CancellationSignal;
import com.photonize.core.work.WorkerPool;
import com.photonize.logging.AppLogger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes copies of a batch into {@code <directory>/<FORMAT>/} as WebP, PNG, JPG or single-page PDF.
 * WebP goes through whichever ImageIO plugin registers a {@code webp} writer.
 * Files are converted in parallel; every file is attempted even if others fail.
 */
public final class ImageExporter {
    private static final Logger LOGGER = AppLogger.get();
    private static final float JPEG_QUALITY = 0.9f;
    private static final float WEBP_QUALITY = 0.9f;
    private static final String WEBP_LOSSY = "Lossy";

    private final int workerCount;
    private final Duration staggerDelay;

    public ImageExporter() {
        this(ConfigService.getInstance().getWorkerCount(), ConfigService.getInstance().getStaggerDelay());
    }

    public ImageExporter(int workerCount, Duration staggerDelay) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("Worker count must be greater than zero: " + workerCount);
        }
        this.workerCount = workerCount;
        this.staggerDelay = staggerDelay == null ? Duration.ZERO : staggerDelay;
    }

    public ExportResult export(List<PhotoEntry> photos,
                               Path directory,
                               ExportFormat format,
                               Function<List<String>, OverwriteDecision> overwrite,
                               ExportProgress progress) {
        return export(photos, directory, format, overwrite, progress, CancellationSignal.none());
    }

    /**
     * @param overwrite asked once with the names of outputs that already exist; {@code null} overwrites
     * @param signal    cancels files that have not finished yet
     */
    public ExportResult export(List<PhotoEntry> photos,
                               Path directory,
                               ExportFormat format,
                               Function<List<String>, OverwriteDecision> overwrite,
                               ExportProgress progress,
                               CancellationSignal signal) {
        if (format == null) {
            throw new IllegalArgumentException("format is required");
        }
        List<PhotoEntry> files = new ArrayList<>();
        if (photos != null) {
            for (PhotoEntry photo : photos) {
                if (!photo.isContainer()) {
                    files.add(photo);
                }
            }
        }
        if (files.isEmpty()) {
            return ExportResult.failed("No photos to export.");
        }
        if (directory == null || !Files.isDirectory(directory)) {
            return ExportResult.failed("Invalid directory path.");
        }

        Path outputFolder = directory.resolve(format.folderName());
        try {
            Files.createDirectories(outputFolder);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Cannot create export folder " + outputFolder, ex);
            return ExportResult.failed("Cannot create output folder: " + ex.getMessage());
        }

        List<ExportJob> jobs = new ArrayList<>();
        List<String> existing = new ArrayList<>();
        Set<String> claimed = new HashSet<>();
        for (PhotoEntry photo : files) {
            Path output = outputFolder.resolve(uniqueName(photo.stem(), format.extension(), claimed));
            jobs.add(new ExportJob(photo.getPath(), output));
            if (Files.exists(output)) {
                existing.add(output.getFileName().toString());
            }
        }

        OverwriteDecision decision = OverwriteDecision.OVERWRITE_ALL;
        if (!existing.isEmpty() && overwrite != null) {
            decision = overwrite.apply(List.copyOf(existing));
        }
        if (decision == OverwriteDecision.CANCEL) {
            return ExportResult.failed("Export cancelled by user.");
        }

        ExportProgress sink = progress == null ? ExportProgress.NONE : progress;
        int total = jobs.size();
        AtomicInteger done = new AtomicInteger();
        AtomicInteger exported = new AtomicInteger();
        int skipped = 0;
        List<String> failures = Collections.synchronizedList(new ArrayList<>());

        WorkerPool.Listener<ExportJob> listener = new WorkerPool.Listener<>() {
            @Override
            public void onCompleted(ExportJob job) {
                exported.incrementAndGet();
                sink.report(done.incrementAndGet(), total, "Exported " + job.output().getFileName());
            }

            @Override
            public void onFailed(ExportJob job, Throwable error) {
                failures.add(job.source().getFileName() + ": " + describe(error));
                sink.report(done.incrementAndGet(), total, "Failed " + job.source().getFileName());
            }
        };

        try (WorkerPool<ExportJob> pool = new WorkerPool<>("export", Math.min(workerCount, total), staggerDelay, listener)) {
            for (ExportJob job : jobs) {
                if (decision == OverwriteDecision.SKIP_EXISTING && Files.exists(job.output())) {
                    skipped++;
                    sink.report(done.incrementAndGet(), total, "Skipped " + job.output().getFileName());
                    continue;
                }
                pool.submit(job, (payload, cancel) -> write(payload, format, cancel), signal);
            }
            pool.drain();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return ExportResult.failed("Export interrupted.");
        }

        ExportResult result = ExportResult.summarize("Export", "exported", "to " + format.folderName() + " format",
                exported.get(), skipped, new ArrayList<>(failures), total, outputFolder);
        LOGGER.info(() -> "Export to " + format + ": " + exported.get() + " exported, " + failures.size() + " failed");
        return result;
    }

    static void write(ExportJob job, ExportFormat format, CancellationSignal signal) throws IOException {
        BufferedImage image = ImageIO.read(job.source().toFile());
        if (image == null) {
            throw new IOException("Unsupported image format");
        }
        signal.throwIfCancelled();
        switch (format) {
            case WEBP -> writeCompressed(toIntRgb(image), job.output(), "webp", WEBP_LOSSY, WEBP_QUALITY);
            case PNG -> {
                if (!ImageIO.write(image, "png", job.output().toFile())) {
                    throw new IOException("No PNG writer available");
                }
            }
            case JPG -> writeCompressed(flatten(image), job.output(), "jpg", null, JPEG_QUALITY);
            case PDF -> writePdf(image, job.output());
            default -> throw new IllegalStateException("Unhandled format " + format);
        }
    }

    private static void writeCompressed(BufferedImage image, Path output, String formatName,
                                        String compressionType, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(formatName);
        if (!writers.hasNext()) {
            throw new IOException("No " + formatName.toUpperCase(Locale.ROOT) + " writer available");
        }
        ImageWriter writer = writers.next();
        Files.deleteIfExists(output);
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(output.toFile())) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                String[] types = param.getCompressionTypes();
                if (compressionType != null && types != null && Arrays.asList(types).contains(compressionType)) {
                    param.setCompressionType(compressionType);
                }
                param.setCompressionQuality(quality);
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    /**
     * One page sized to the image, the image drawn edge to edge.
     */
    private static void writePdf(BufferedImage image, Path output) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDRectangle box = new PDRectangle(image.getWidth(), image.getHeight());
            PDPage page = new PDPage(box);
            document.addPage(page);
            PDImageXObject xObject = LosslessFactory.createFromImage(document, image);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.drawImage(xObject, 0, 0, box.getWidth(), box.getHeight());
            }
            document.save(output.toFile());
        }
    }

    // a.jpg and a.png both map to a.<ext>; later ones get a numbered suffix
    static String uniqueName(String stem, String extension, Set<String> claimed) {
        String candidate = stem + extension;
        for (int n = 2; !claimed.add(candidate.toLowerCase(Locale.ROOT)); n++) {
            candidate = stem + " (" + n + ")" + extension;
        }
        return candidate;
    }

    // JPEG has no alpha channel
    static BufferedImage flatten(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB || image.getType() == BufferedImage.TYPE_3BYTE_BGR) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    // the WebP encoder reads packed int pixels only
    static BufferedImage toIntRgb(BufferedImage image) {
        int type = image.getType();
        if (type == BufferedImage.TYPE_INT_ARGB || type == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        int target = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), target);
        Graphics2D g = converted.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return converted;
    }

    static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getMessage() == null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    record ExportJob(Path source, Path output) {
    }
}
