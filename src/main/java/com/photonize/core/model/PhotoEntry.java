package com.photonize.core.model;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * One file or folder placeholder in an ordered photo batch.
 * <p>
 * Not thread-safe: entries belong to the thread that owns the {@link PhotoBatch}. Background work
 * must hand its results back to that thread before touching an entry.
 */
public final class PhotoEntry {
    private Path path;
    private String displayName;
    private int displayOrder;
    private final boolean container;
    private BufferedImage thumbnail;

    private PhotoEntry(Path path, int displayOrder, boolean container) {
        setPath(path);
        this.displayOrder = displayOrder;
        this.container = container;
    }

    public static PhotoEntry file(Path path, int displayOrder) {
        return new PhotoEntry(path, displayOrder, false);
    }

    public static PhotoEntry container(Path path, int displayOrder) {
        return new PhotoEntry(path, displayOrder, true);
    }

    public Path getPath() {
        return path;
    }

    /**
     * Points the entry at a new location and refreshes {@link #getDisplayName()} to match.
     */
    public void setPath(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path is required");
        }
        Path normalized = path.toAbsolutePath().normalize();
        Path fileName = normalized.getFileName();
        this.path = normalized;
        this.displayName = fileName == null ? normalized.toString() : fileName.toString();
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getDisplayOrder() {
        return displayOrder;
    }

    public void setDisplayOrder(int displayOrder) {
        this.displayOrder = displayOrder;
    }

    public boolean isContainer() {
        return container;
    }

    public Optional<BufferedImage> getThumbnail() {
        return Optional.ofNullable(thumbnail);
    }

    public void setThumbnail(BufferedImage thumbnail) {
        this.thumbnail = thumbnail;
    }

    /**
     * Extension including the leading dot, exactly as written on disk, or {@code ""}.
     */
    public String extension() {
        return extensionOf(displayName);
    }

    /**
     * File name without its extension.
     */
    public String stem() {
        String ext = extension();
        return displayName.substring(0, displayName.length() - ext.length());
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot);
    }

    public static String lowerExtensionOf(Path path) {
        Path name = path == null ? null : path.getFileName();
        return name == null ? "" : extensionOf(name.toString()).toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return (container ? "[dir] " : "") + displayName + " #" + displayOrder;
    }
}
