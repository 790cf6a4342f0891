package com.photonize.core.thumbnail;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ThumbnailDecoder} backed by {@link ImageIO}. Decodes on the calling thread, which is
 * expected to be a {@link com.photonize.core.work.WorkerPool} worker.
 */
public final class ImageIoThumbnailDecoder implements ThumbnailDecoder {

    @Override
    public CompletableFuture<BufferedImage> decode(Path path, int maxDimension) {
        try {
            return CompletableFuture.completedFuture(decodeNow(path, maxDimension));
        } catch (IOException ex) {
            return CompletableFuture.failedFuture(ex);
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(new IOException("Cannot decode " + path, ex));
        }
    }

    static BufferedImage decodeNow(Path path, int maxDimension) throws IOException {
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
        }
        BufferedImage source = ImageIO.read(path.toFile());
        if (source == null) {
            throw new IOException("Unsupported or corrupt image: " + path.getFileName());
        }
        return scaleToFit(source, maxDimension);
    }

    static BufferedImage scaleToFit(BufferedImage source, int maxDimension) {
        int width = source.getWidth();
        int height = source.getHeight();
        int longest = Math.max(width, height);
        if (longest <= maxDimension) {
            return source;
        }
        double scale = (double) maxDimension / longest;
        int targetWidth = Math.max(1, (int) Math.round(width * scale));
        int targetHeight = Math.max(1, (int) Math.round(height * scale));

        int type = source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, type);
        Graphics2D g2 = scaled.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g2.dispose();
        }
        return scaled;
    }
}
