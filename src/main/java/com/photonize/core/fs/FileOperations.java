package com.photonize.core.fs;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem primitives used by renaming, importing and exporting.
 * Swappable so tests can inject failures at a chosen step.
 */
public interface FileOperations {

    /**
     * Renames {@code source} to {@code target} atomically. Fails if the target exists or the move
     * would cross volumes.
     */
    void move(Path source, Path target) throws IOException;

    /**
     * Copies {@code source} to {@code target}; never overwrites.
     */
    void copy(Path source, Path target) throws IOException;

    void delete(Path path) throws IOException;

    boolean exists(Path path);
}
