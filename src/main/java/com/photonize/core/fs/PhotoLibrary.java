package com.photonize.core.fs;

import com.photonize.core.model.PhotoBatch;
import com.photonize.core.model.PhotoEntry;
import com.photonize.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link PhotoBatch} from a directory listing: subfolders first, then photos.
 */
public final class PhotoLibrary {
    private static final Logger LOGGER = AppLogger.get();

    public PhotoBatch load(Path directory) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new NotDirectoryException(String.valueOf(directory));
        }

        List<Path> folders;
        try (Stream<Path> stream = Files.list(directory)) {
            folders = stream
                .filter(Files::isDirectory)
                .filter(p -> !ImageFiles.isHidden(p))
                .sorted(ImageFiles.BY_NAME)
                .collect(Collectors.toList());
        }
        List<Path> photos = ImageFiles.listImageFiles(directory);

        List<PhotoEntry> entries = new ArrayList<>(folders.size() + photos.size());
        int order = 0;
        for (Path folder : folders) {
            entries.add(PhotoEntry.container(folder, order++));
        }
        for (Path photo : photos) {
            entries.add(PhotoEntry.file(photo, order++));
        }

        LOGGER.fine(() -> "Loaded " + photos.size() + " photo(s) and " + folders.size()
            + " folder(s) from " + directory);
        return new PhotoBatch(entries);
    }
}
