package com.photonize.core.thumbnail;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Turns an image file into a thumbnail whose longer edge is at most {@code maxDimension}.
 * The future fails with an {@link java.io.IOException} (possibly wrapped) when the file cannot be decoded.
 */
@FunctionalInterface
public interface ThumbnailDecoder {
    CompletableFuture<BufferedImage> decode(Path path, int maxDimension);
}
