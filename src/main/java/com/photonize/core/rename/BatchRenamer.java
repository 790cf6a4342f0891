package com.photonize.core.rename;

import com.photonize.core.fs.FileOperations;
import com.photonize.core.fs.NioFileOperations;
import com.photonize.core.model.PhotoEntry;
import com.photonize.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renames an ordered batch to {@code prefix-00001.ext}, {@code prefix-00002.ext}, ... in display order.
 * <p>
 * Every target is checked before the first move. Moves then go through a temporary name so that
 * files in the same batch can trade names. A failure in either pass stops the run and leaves
 * already-moved files under their temporary names; nothing is rolled back.
 * Callers must not run two renames on the same directory at once.
 */
public final class BatchRenamer {
    private static final Logger LOGGER = AppLogger.get();

    public static final String TEMP_SUFFIX = ".tmp_rename";
    private static final String RESERVED_CHARACTERS = "<>:\"/\\|?*";

    private final FileOperations files;

    public BatchRenamer() {
        this(new NioFileOperations());
    }

    public BatchRenamer(FileOperations files) {
        this.files = files;
    }

    public static boolean validatePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (RESERVED_CHARACTERS.indexOf(c) >= 0 || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * File name for position {@code index} (0-based) in the batch.
     */
    public static String targetName(String prefix, int index, String extension) {
        return String.format(Locale.ROOT, "%s-%05d%s", prefix, index + 1, extension == null ? "" : extension);
    }

    public RenameResult rename(List<PhotoEntry> entries, String prefix) {
        List<PhotoEntry> renamable = new ArrayList<>();
        if (entries != null) {
            for (PhotoEntry entry : entries) {
                if (entry != null && !entry.isContainer()) {
                    renamable.add(entry);
                }
            }
        }
        if (renamable.isEmpty()) {
            return RenameResult.failed(RenameFailure.NO_WORK, "No photos to rename.");
        }
        if (!validatePrefix(prefix)) {
            return RenameResult.failed(RenameFailure.INVALID_PREFIX,
                "Invalid prefix. Please use only valid filename characters.");
        }

        renamable.sort(Comparator.comparingInt(PhotoEntry::getDisplayOrder));
        List<RenameOperation> plan = plan(renamable, prefix);

        Set<Path> batchPaths = new HashSet<>();
        for (RenameOperation op : plan) {
            batchPaths.add(op.sourcePath());
        }
        for (RenameOperation op : plan) {
            if (op.isNoOp()) {
                continue;
            }
            if (files.exists(op.finalPath()) && !batchPaths.contains(op.finalPath())) {
                String name = String.valueOf(op.finalPath().getFileName());
                return RenameResult.failed(RenameFailure.NAME_CONFLICT,
                    "File already exists: " + name + ". Please choose a different prefix.", name, 0, null);
            }
            Path temp = tempPath(op.sourcePath());
            if (files.exists(temp)) {
                String name = String.valueOf(temp.getFileName());
                return RenameResult.failed(RenameFailure.NAME_CONFLICT,
                    "Temporary file already exists: " + name + ". Remove it and try again.", name, 0, null);
            }
        }

        List<RenameOperation> staged = new ArrayList<>();
        for (RenameOperation op : plan) {
            if (op.isNoOp()) {
                continue;
            }
            try {
                files.move(op.sourcePath(), tempPath(op.sourcePath()));
                staged.add(op);
            } catch (IOException ex) {
                return ioFailure(op.sourcePath(), staged.size(), ex);
            }
        }

        int moved = 0;
        for (RenameOperation op : staged) {
            try {
                files.move(tempPath(op.sourcePath()), op.finalPath());
            } catch (IOException ex) {
                return ioFailure(op.sourcePath(), moved, ex);
            }
            op.entry().setPath(op.finalPath());
            moved++;
            LOGGER.fine(() -> "Renamed " + op.sourcePath().getFileName() + " -> " + op.finalPath().getFileName());
        }

        int total = moved;
        LOGGER.info(() -> "Renamed " + total + " of " + plan.size() + " file(s) with prefix '" + prefix + "'");
        return RenameResult.moved(moved);
    }

    List<RenameOperation> plan(List<PhotoEntry> sorted, String prefix) {
        List<RenameOperation> operations = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            PhotoEntry entry = sorted.get(i);
            Path source = entry.getPath();
            Path target = source.resolveSibling(targetName(prefix, i, entry.extension()));
            operations.add(new RenameOperation(source, target, entry));
        }
        return operations;
    }

    static Path tempPath(Path source) {
        return source.resolveSibling(source.getFileName() + TEMP_SUFFIX);
    }

    private RenameResult ioFailure(Path source, int movedSoFar, IOException ex) {
        String name = String.valueOf(source.getFileName());
        LOGGER.log(Level.SEVERE, "Rename stopped at " + name, ex);
        return RenameResult.failed(RenameFailure.IO_FAILURE,
            "Error during rename of " + name + ": " + ex.getMessage(), name, movedSoFar, ex);
    }
}
