package com.photonize.core.export;

import java.util.Locale;

/**
 * Output formats offered by {@link ImageExporter}. Each one writes into its own subfolder.
 */
public enum ExportFormat {
    WEBP("WebP", ".webp"),
    PNG("PNG", ".png"),
    JPG("JPG", ".jpg"),
    PDF("PDF", ".pdf");

    private final String folderName;
    private final String extension;

    ExportFormat(String folderName, String extension) {
        this.folderName = folderName;
        this.extension = extension;
    }

    public String folderName() {
        return folderName;
    }

    public String extension() {
        return extension;
    }

    public static ExportFormat parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("export format is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("JPEG")) {
            return JPG;
        }
        return ExportFormat.valueOf(normalized);
    }
}
