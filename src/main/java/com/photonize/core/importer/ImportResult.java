package com.photonize.core.importer;

import com.photonize.core.model.PhotoEntry;
import com.photonize.core.rename.RenameFailure;

import java.util.List;

/**
 * Outcome of {@link PhotoImporter#importFiles}. {@code imported} holds the entries created for the
 * incoming files, in their final order.
 */
public record ImportResult(boolean success,
                           int importedCount,
                           String message,
                           RenameFailure failure,
                           String offendingFile,
                           List<PhotoEntry> imported) {

    public ImportResult {
        imported = imported == null ? List.of() : List.copyOf(imported);
    }

    static ImportResult failed(RenameFailure failure, String message) {
        return new ImportResult(false, 0, message, failure, null, List.of());
    }

    static ImportResult failed(RenameFailure failure, String message, String offendingFile) {
        return new ImportResult(false, 0, message, failure, offendingFile, List.of());
    }
}
