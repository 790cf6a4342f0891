package com.photonize.core.fs;

import com.photonize.core.model.PhotoBatch;
import com.photonize.core.model.PhotoEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhotoLibraryTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsFoldersFirstThenPhotos() throws Exception {
        Files.createDirectory(tempDir.resolve("zeta"));
        Files.createDirectory(tempDir.resolve(".cache"));
        Files.writeString(tempDir.resolve("b.jpg"), "x");
        Files.writeString(tempDir.resolve("a.png"), "x");
        Files.writeString(tempDir.resolve("list.csv"), "x");

        PhotoBatch batch = new PhotoLibrary().load(tempDir);

        List<PhotoEntry> entries = batch.entries();
        assertEquals(3, entries.size());
        assertTrue(entries.get(0).isContainer());
        assertEquals("zeta", entries.get(0).getDisplayName());
        assertEquals("a.png", entries.get(1).getDisplayName());
        assertEquals("b.jpg", entries.get(2).getDisplayName());
        assertFalse(entries.get(2).isContainer());
        for (int i = 0; i < entries.size(); i++) {
            assertEquals(i, entries.get(i).getDisplayOrder());
        }
    }

    @Test
    void missingDirectoryIsRejected() {
        assertThrows(NotDirectoryException.class, () -> new PhotoLibrary().load(tempDir.resolve("missing")));
    }
}
