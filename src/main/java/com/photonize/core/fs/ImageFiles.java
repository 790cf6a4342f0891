package com.photonize.core.fs;

import com.photonize.core.model.PhotoEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Knows which files count as photos.
 */
public final class ImageFiles {
    public static final Set<String> SUPPORTED_EXTENSIONS =
        Set.of(".jpg", ".jpeg", ".png", ".bmp", ".gif", ".tiff", ".tif", ".webp");

    static final Comparator<Path> BY_NAME =
        Comparator.comparing(p -> String.valueOf(p.getFileName()), String.CASE_INSENSITIVE_ORDER);

    private ImageFiles() {
    }

    public static boolean isImageFile(Path path) {
        return SUPPORTED_EXTENSIONS.contains(PhotoEntry.lowerExtensionOf(path));
    }

    /**
     * Regular, non-hidden image files directly inside {@code directory}, sorted by name.
     */
    public static List<Path> listImageFiles(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> !isHidden(p))
                .filter(ImageFiles::isImageFile)
                .sorted(BY_NAME)
                .collect(Collectors.toList());
        }
    }

    static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
