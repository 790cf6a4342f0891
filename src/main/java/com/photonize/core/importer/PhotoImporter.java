package com.photonize.core.importer;

import com.photonize.core.fs.FileOperations;
import com.photonize.core.fs.ImageFiles;
import com.photonize.core.fs.NioFileOperations;
import com.photonize.core.merge.BatchMerger;
import com.photonize.core.merge.ImportMode;
import com.photonize.core.merge.MergePlan;
import com.photonize.core.merge.MergeSlot;
import com.photonize.core.model.PhotoBatch;
import com.photonize.core.model.PhotoEntry;
import com.photonize.core.rename.BatchRenamer;
import com.photonize.core.rename.RenameFailure;
import com.photonize.core.thumbnail.ThumbnailLoader;
import com.photonize.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings outside photos into a batch directory at positions chosen by {@link BatchMerger}, renaming
 * every photo to the {@code prefix-nnnnn} scheme on the way.
 * <p>
 * Same staging approach as {@link BatchRenamer}: conflicts are found before any file is touched,
 * existing photos are parked under a temporary name, then every slot is filled in index order.
 * There is no rollback if a copy or move fails mid-way.
 */
public final class PhotoImporter {
    private static final Logger LOGGER = AppLogger.get();

    public static final String TEMP_SUFFIX = ".tmp_import";

    private final BatchMerger merger = new BatchMerger();
    private final FileOperations files;
    private final ThumbnailLoader thumbnails;

    public PhotoImporter() {
        this(new NioFileOperations(), null);
    }

    /**
     * @param thumbnails loader to queue decodes for imported photos, or {@code null} to skip them
     */
    public PhotoImporter(FileOperations files, ThumbnailLoader thumbnails) {
        this.files = files;
        this.thumbnails = thumbnails;
    }

    public ImportResult importFiles(List<Path> sources,
                                    PhotoBatch batch,
                                    Path targetDirectory,
                                    String prefix,
                                    ImportMode mode) {
        if (sources == null || sources.isEmpty()) {
            return ImportResult.failed(RenameFailure.NO_WORK, "No files to import.");
        }
        List<Path> images = sources.stream()
            .filter(ImageFiles::isImageFile)
            .map(p -> p.toAbsolutePath().normalize())
            .toList();
        if (images.isEmpty()) {
            return ImportResult.failed(RenameFailure.NO_WORK, "No supported image files found in the selection.");
        }
        if (targetDirectory == null || !Files.isDirectory(targetDirectory)) {
            return ImportResult.failed(RenameFailure.IO_FAILURE, "Target directory does not exist.");
        }
        if (!BatchRenamer.validatePrefix(prefix)) {
            return ImportResult.failed(RenameFailure.INVALID_PREFIX,
                "Invalid prefix. Please use only valid filename characters.");
        }

        Path target = targetDirectory.toAbsolutePath().normalize();
        List<Path> incoming = images.stream()
            .filter(p -> !target.equals(p.getParent()))
            .toList();
        if (incoming.isEmpty()) {
            return ImportResult.failed(RenameFailure.NO_WORK, "All selected files are already in the target directory.");
        }

        List<PhotoEntry> existing = batch.files();
        MergePlan plan = merger.plan(mode, existing, incoming);

        Map<Path, PhotoEntry> existingByPath = new HashMap<>();
        for (PhotoEntry entry : existing) {
            existingByPath.put(entry.getPath(), entry);
        }
        List<Path> finalPaths = new ArrayList<>(plan.size());
        for (MergeSlot slot : plan.slots()) {
            String ext = PhotoEntry.extensionOf(String.valueOf(slot.sourcePath().getFileName()));
            finalPaths.add(target.resolve(BatchRenamer.targetName(prefix, slot.finalIndex(), ext)));
        }

        ImportResult conflict = findConflict(plan, finalPaths, existingByPath.keySet());
        if (conflict != null) {
            return conflict;
        }

        Set<Path> staged = new HashSet<>();
        for (int i = 0; i < plan.size(); i++) {
            MergeSlot slot = plan.slots().get(i);
            if (slot.newFile() || slot.sourcePath().equals(finalPaths.get(i))) {
                continue;
            }
            try {
                files.move(slot.sourcePath(), tempPath(slot.sourcePath()));
                staged.add(slot.sourcePath());
            } catch (IOException ex) {
                return ioFailure(slot.sourcePath(), ex);
            }
        }

        List<PhotoEntry> ordered = new ArrayList<>(plan.size());
        List<PhotoEntry> imported = new ArrayList<>();
        for (int i = 0; i < plan.size(); i++) {
            MergeSlot slot = plan.slots().get(i);
            Path finalPath = finalPaths.get(i);
            try {
                if (slot.newFile()) {
                    files.copy(slot.sourcePath(), finalPath);
                } else if (staged.contains(slot.sourcePath())) {
                    files.move(tempPath(slot.sourcePath()), finalPath);
                }
            } catch (IOException ex) {
                return ioFailure(slot.sourcePath(), ex);
            }
            PhotoEntry entry;
            if (slot.newFile()) {
                entry = PhotoEntry.file(finalPath, slot.finalIndex());
                imported.add(entry);
            } else {
                entry = existingByPath.get(slot.sourcePath());
                entry.setPath(finalPath);
            }
            ordered.add(entry);
        }

        List<PhotoEntry> rebuilt = new ArrayList<>(batch.containers());
        rebuilt.addAll(ordered);
        for (int i = 0; i < rebuilt.size(); i++) {
            rebuilt.get(i).setDisplayOrder(i);
        }
        batch.replaceAll(rebuilt);

        if (thumbnails != null) {
            List<PhotoEntry> missing = ordered.stream().filter(e -> e.getThumbnail().isEmpty()).toList();
            thumbnails.request(missing);
        }

        String verb = mode == ImportMode.DISTRIBUTE ? "distributed" : "appended";
        String message = "Successfully " + verb + " " + imported.size() + " file(s).";
        LOGGER.info(message + " Batch now holds " + ordered.size() + " photo(s).");
        return new ImportResult(true, imported.size(), message, null, null, imported);
    }

    private ImportResult findConflict(MergePlan plan, List<Path> finalPaths, Set<Path> batchPaths) {
        for (int i = 0; i < plan.size(); i++) {
            MergeSlot slot = plan.slots().get(i);
            Path finalPath = finalPaths.get(i);
            if (slot.newFile() && !files.exists(slot.sourcePath())) {
                String name = String.valueOf(slot.sourcePath().getFileName());
                return ImportResult.failed(RenameFailure.IO_FAILURE, "Source file not found: " + name, name);
            }
            if (!slot.sourcePath().equals(finalPath) && files.exists(finalPath) && !batchPaths.contains(finalPath)) {
                String name = String.valueOf(finalPath.getFileName());
                return ImportResult.failed(RenameFailure.NAME_CONFLICT,
                    "File already exists: " + name + ". Please choose a different prefix.", name);
            }
            if (!slot.newFile() && files.exists(tempPath(slot.sourcePath()))) {
                String name = String.valueOf(tempPath(slot.sourcePath()).getFileName());
                return ImportResult.failed(RenameFailure.NAME_CONFLICT,
                    "Temporary file already exists: " + name + ". Remove it and try again.", name);
            }
        }
        return null;
    }

    private static Path tempPath(Path source) {
        return source.resolveSibling(source.getFileName() + TEMP_SUFFIX);
    }

    private static ImportResult ioFailure(Path source, IOException ex) {
        String name = String.valueOf(source.getFileName());
        LOGGER.log(Level.SEVERE, "Import stopped at " + name, ex);
        return ImportResult.failed(RenameFailure.IO_FAILURE, "Error during import of " + name + ": " + ex.getMessage(), name);
    }
}
