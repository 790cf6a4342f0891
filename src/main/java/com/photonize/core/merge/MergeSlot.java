package com.photonize.core.merge;

import java.nio.file.Path;

/**
 * One position in a {@link MergePlan}: which file ends up at {@code finalIndex}, and whether it
 * is coming from outside the batch.
 */
public record MergeSlot(Path sourcePath, boolean newFile, int finalIndex) {
}
