package com.photonize.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhotoBatchTest {

    private static PhotoBatch batchOf(String... names) {
        PhotoBatch batch = new PhotoBatch();
        List<PhotoEntry> entries = new java.util.ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            entries.add(PhotoEntry.file(Path.of("photos", names[i]), i));
        }
        batch.replaceAll(entries);
        return batch;
    }

    private static String names(PhotoBatch batch) {
        return batch.entries().stream().map(PhotoEntry::getDisplayName).collect(Collectors.joining(","));
    }

    private static void assertOrdersMatchPositions(PhotoBatch batch) {
        for (int i = 0; i < batch.size(); i++) {
            assertEquals(i, batch.entries().get(i).getDisplayOrder());
        }
    }

    @Test
    void replaceAllSortsStablyAndRenumbers() {
        PhotoEntry a = PhotoEntry.file(Path.of("a.jpg"), 5);
        PhotoEntry b = PhotoEntry.file(Path.of("b.jpg"), 1);
        PhotoEntry c = PhotoEntry.file(Path.of("c.jpg"), 5);
        PhotoBatch batch = new PhotoBatch(List.of(a, b, c));
        assertEquals("b.jpg,a.jpg,c.jpg", names(batch));
        assertOrdersMatchPositions(batch);
    }

    @Test
    void moveSingleItemForward() {
        PhotoBatch batch = batchOf("a.jpg", "b.jpg", "c.jpg", "d.jpg");
        batch.move(List.of(batch.entries().get(0)), 3);
        assertEquals("b.jpg,c.jpg,a.jpg,d.jpg", names(batch));
        assertOrdersMatchPositions(batch);
    }

    @Test
    void moveSingleItemBackward() {
        PhotoBatch batch = batchOf("a.jpg", "b.jpg", "c.jpg", "d.jpg");
        batch.move(List.of(batch.entries().get(3)), 1);
        assertEquals("a.jpg,d.jpg,b.jpg,c.jpg", names(batch));
    }

    @Test
    void moveSeveralKeepsTheirRelativeOrder() {
        PhotoBatch batch = batchOf("a.jpg", "b.jpg", "c.jpg", "d.jpg", "e.jpg");
        List<PhotoEntry> all = batch.entries();
        batch.move(List.of(all.get(3), all.get(0)), 2);
        assertEquals("b.jpg,a.jpg,d.jpg,c.jpg,e.jpg", names(batch));
        assertOrdersMatchPositions(batch);
    }

    @Test
    void moveToEndClampsIndex() {
        PhotoBatch batch = batchOf("a.jpg", "b.jpg", "c.jpg");
        batch.move(List.of(batch.entries().get(0)), 99);
        assertEquals("b.jpg,c.jpg,a.jpg", names(batch));
    }

    @Test
    void moveIgnoresUnknownEntries() {
        PhotoBatch batch = batchOf("a.jpg", "b.jpg");
        batch.move(List.of(PhotoEntry.file(Path.of("photos", "a.jpg"), 0)), 2);
        assertEquals("a.jpg,b.jpg", names(batch));
    }

    @Test
    void removeRenumbers() {
        PhotoBatch batch = batchOf("a.jpg", "b.jpg", "c.jpg");
        assertTrue(batch.remove(batch.entries().get(1)));
        assertFalse(batch.remove(PhotoEntry.file(Path.of("zzz.jpg"), 0)));
        assertEquals("a.jpg,c.jpg", names(batch));
        assertOrdersMatchPositions(batch);
    }

    @Test
    void filesAndContainersAreSplit() {
        PhotoBatch batch = new PhotoBatch(List.of(
            PhotoEntry.container(Path.of("album"), 0),
            PhotoEntry.file(Path.of("a.jpg"), 1)));
        assertEquals(1, batch.files().size());
        assertEquals(1, batch.containers().size());
        assertThrows(UnsupportedOperationException.class, () -> batch.entries().clear());
    }

    @Test
    void entryNamePartsFollowPath() {
        PhotoEntry entry = PhotoEntry.file(Path.of("dir", "Holiday.Final.JPG"), 0);
        assertEquals(".JPG", entry.extension());
        assertEquals("Holiday.Final", entry.stem());
        entry.setPath(Path.of("dir", "trip-00001.JPG"));
        assertEquals("trip-00001.JPG", entry.getDisplayName());
        assertTrue(entry.getPath().isAbsolute());
        assertEquals("", PhotoEntry.extensionOf(".hidden"));
        assertEquals(".png", PhotoEntry.lowerExtensionOf(Path.of("x.PNG")));
    }
}
