package com.photonize.core.rename;

import com.photonize.core.fs.FileOperations;
import com.photonize.core.fs.NioFileOperations;
import com.photonize.core.model.PhotoEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchRenamerTest {

    @TempDir
    Path tempDir;

    private List<PhotoEntry> photos(String... names) throws IOException {
        List<PhotoEntry> entries = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            Path file = Files.writeString(tempDir.resolve(names[i]), names[i]);
            entries.add(PhotoEntry.file(file, i));
        }
        return entries;
    }

    @Test
    void renamesInDisplayOrderKeepingExtensions() throws Exception {
        List<PhotoEntry> entries = photos("IMG_1234.jpg", "DSC0001.PNG", "beach.jpeg");
        entries.get(0).setDisplayOrder(2);
        entries.get(2).setDisplayOrder(0);

        RenameResult result = new BatchRenamer().rename(entries, "trip");

        assertTrue(result.success(), result.message());
        assertEquals(3, result.movedCount());
        assertEquals("beach.jpeg", Files.readString(tempDir.resolve("trip-00001.jpeg")));
        assertEquals("DSC0001.PNG", Files.readString(tempDir.resolve("trip-00002.PNG")));
        assertEquals("IMG_1234.jpg", Files.readString(tempDir.resolve("trip-00003.jpg")));
        assertEquals("trip-00003.jpg", entries.get(0).getDisplayName());
        assertEquals(tempDir.resolve("trip-00001.jpeg").toAbsolutePath(), entries.get(2).getPath());
        assertFalse(Files.exists(tempDir.resolve("IMG_1234.jpg")));
    }

    @Test
    void tripExampleNumbersByDisplayOrder() throws Exception {
        List<PhotoEntry> entries = photos("a.jpg", "b.jpg");
        entries.get(0).setDisplayOrder(1);
        entries.get(1).setDisplayOrder(0);

        assertTrue(new BatchRenamer().rename(entries, "trip").success());

        assertEquals("b.jpg", Files.readString(tempDir.resolve("trip-00001.jpg")));
        assertEquals("a.jpg", Files.readString(tempDir.resolve("trip-00002.jpg")));
    }

    @Test
    void swapsNamesWithinTheBatch() throws Exception {
        List<PhotoEntry> entries = photos("trip-00002.jpg", "trip-00001.jpg");

        RenameResult result = new BatchRenamer().rename(entries, "trip");

        assertTrue(result.success(), result.message());
        assertEquals("trip-00002.jpg", Files.readString(tempDir.resolve("trip-00001.jpg")));
        assertEquals("trip-00001.jpg", Files.readString(tempDir.resolve("trip-00002.jpg")));
        try (var listing = Files.list(tempDir)) {
            assertTrue(listing.noneMatch(p -> p.toString().endsWith(BatchRenamer.TEMP_SUFFIX)));
        }
    }

    @Test
    void secondRunIsANoOp() throws Exception {
        List<PhotoEntry> entries = photos("b.jpg", "a.jpg");
        BatchRenamer renamer = new BatchRenamer();
        assertTrue(renamer.rename(entries, "x").success());

        RenameResult again = renamer.rename(entries, "x");

        assertTrue(again.success());
        assertEquals(0, again.movedCount());
        assertEquals("b.jpg", Files.readString(tempDir.resolve("x-00001.jpg")));
    }

    @Test
    void refusesTargetOwnedByFileOutsideTheBatch() throws Exception {
        List<PhotoEntry> entries = photos("a.jpg", "b.jpg");
        Files.writeString(tempDir.resolve("trip-00002.jpg"), "stranger");

        RenameResult result = new BatchRenamer().rename(entries, "trip");

        assertFalse(result.success());
        assertEquals(RenameFailure.NAME_CONFLICT, result.failureKind().orElseThrow());
        assertEquals("trip-00002.jpg", result.offendingFile());
        assertTrue(Files.exists(tempDir.resolve("a.jpg")));
        assertTrue(Files.exists(tempDir.resolve("b.jpg")));
        assertEquals("stranger", Files.readString(tempDir.resolve("trip-00002.jpg")));
    }

    @Test
    void refusesWhenLeftoverTempFileExists() throws Exception {
        List<PhotoEntry> entries = photos("a.jpg");
        Files.writeString(tempDir.resolve("a.jpg" + BatchRenamer.TEMP_SUFFIX), "old");

        RenameResult result = new BatchRenamer().rename(entries, "trip");

        assertEquals(RenameFailure.NAME_CONFLICT, result.failure());
        assertTrue(Files.exists(tempDir.resolve("a.jpg")));
    }

    @Test
    void rejectsBadPrefixBeforeTouchingDisk() throws Exception {
        List<PhotoEntry> entries = photos("a.jpg");
        for (String bad : new String[]{"", "  ", "a/b", "a:b", "what?", "x\u0001"}) {
            RenameResult result = new BatchRenamer().rename(entries, bad);
            assertEquals(RenameFailure.INVALID_PREFIX, result.failure(), bad);
        }
        assertTrue(Files.exists(tempDir.resolve("a.jpg")));
        assertTrue(BatchRenamer.validatePrefix("Summer 2024_trip"));
        assertTrue(BatchRenamer.validatePrefix("vacation"));
    }

    @Test
    void emptyOrFolderOnlyBatchHasNoWork() {
        PhotoEntry folder = PhotoEntry.container(tempDir.resolve("album"), 0);
        assertEquals(RenameFailure.NO_WORK, new BatchRenamer().rename(List.of(folder), "trip").failure());
        assertEquals(RenameFailure.NO_WORK, new BatchRenamer().rename(List.of(), "trip").failure());
        assertEquals(RenameFailure.NO_WORK, new BatchRenamer().rename(null, "trip").failure());
    }

    @Test
    void foldersInTheBatchAreLeftAlone() throws Exception {
        Path album = Files.createDirectory(tempDir.resolve("album"));
        List<PhotoEntry> entries = new ArrayList<>(photos("a.jpg"));
        entries.add(0, PhotoEntry.container(album, 0));
        entries.get(1).setDisplayOrder(1);

        RenameResult result = new BatchRenamer().rename(entries, "trip");

        assertTrue(result.success());
        assertTrue(Files.isDirectory(album));
        assertTrue(Files.exists(tempDir.resolve("trip-00001.jpg")));
    }

    @Test
    void ioFailureStopsAndNamesTheFile() throws Exception {
        List<PhotoEntry> entries = photos("a.jpg", "b.jpg", "c.jpg");
        FileOperations failing = new FailingMoves(new NioFileOperations(), 2);

        RenameResult result = new BatchRenamer(failing).rename(entries, "trip");

        assertFalse(result.success());
        assertEquals(RenameFailure.IO_FAILURE, result.failure());
        assertEquals("b.jpg", result.offendingFile());
        assertNotNull(result.cause());
        assertTrue(result.message().contains("b.jpg"));
        assertTrue(Files.exists(tempDir.resolve("a.jpg" + BatchRenamer.TEMP_SUFFIX)));
        assertTrue(Files.exists(tempDir.resolve("b.jpg")));
    }

    @Test
    void targetNameIsOneBasedAndPadded() {
        assertEquals("trip-00001.jpg", BatchRenamer.targetName("trip", 0, ".jpg"));
        assertEquals("trip-00123.PNG", BatchRenamer.targetName("trip", 122, ".PNG"));
        assertEquals("trip-00001", BatchRenamer.targetName("trip", 0, ""));
    }

    /**
     * Fails the n-th move (1-based).
     */
    private static final class FailingMoves implements FileOperations {
        private final FileOperations delegate;
        private final int failOn;
        private int moves;

        FailingMoves(FileOperations delegate, int failOn) {
            this.delegate = delegate;
            this.failOn = failOn;
        }

        @Override
        public void move(Path source, Path target) throws IOException {
            if (++moves == failOn) {
                throw new IOException("simulated failure");
            }
            delegate.move(source, target);
        }

        @Override
        public void copy(Path source, Path target) throws IOException {
            delegate.copy(source, target);
        }

        @Override
        public void delete(Path path) throws IOException {
            delegate.delete(path);
        }

        @Override
        public boolean exists(Path path) {
            return delegate.exists(path);
        }
    }
}
