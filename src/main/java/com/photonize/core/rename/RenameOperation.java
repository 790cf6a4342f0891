package com.photonize.core.rename;

import com.photonize.core.model.PhotoEntry;

import java.nio.file.Path;

/**
 * One planned move of {@code entry} from {@code sourcePath} to {@code finalPath}.
 */
public record RenameOperation(Path sourcePath, Path finalPath, PhotoEntry entry) {

    public boolean isNoOp() {
        return sourcePath.equals(finalPath);
    }
}
