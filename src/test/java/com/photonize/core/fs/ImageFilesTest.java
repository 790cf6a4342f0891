package com.photonize.core.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void recognisesImageExtensionsIgnoringCase() {
        assertTrue(ImageFiles.isImageFile(Path.of("a.JPG")));
        assertTrue(ImageFiles.isImageFile(Path.of("a.webp")));
        assertFalse(ImageFiles.isImageFile(Path.of("notes.txt")));
        assertFalse(ImageFiles.isImageFile(Path.of("jpg")));
    }

    @Test
    void listsVisibleImagesSortedByName() throws Exception {
        Files.writeString(tempDir.resolve("b.png"), "x");
        Files.writeString(tempDir.resolve("A.jpg"), "x");
        Files.writeString(tempDir.resolve(".c.jpg"), "x");
        Files.writeString(tempDir.resolve("readme.txt"), "x");
        Files.createDirectory(tempDir.resolve("folder.jpg"));

        List<Path> images = ImageFiles.listImageFiles(tempDir);

        assertEquals(List.of(tempDir.resolve("A.jpg"), tempDir.resolve("b.png")), images);
    }
}
