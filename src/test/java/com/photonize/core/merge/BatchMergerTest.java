package com.photonize.core.merge;

import com.photonize.core.model.PhotoEntry;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class BatchMergerTest {

    private final BatchMerger merger = new BatchMerger();

    private static List<PhotoEntry> existing(int count) {
        List<PhotoEntry> entries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            entries.add(PhotoEntry.file(Path.of("old-" + i + ".jpg"), i));
        }
        return entries;
    }

    private static List<Path> incoming(int count) {
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            paths.add(Path.of("new-" + i + ".jpg"));
        }
        return paths;
    }

    @Test
    void distributeSpreadsTwoNewFilesAmongEight() {
        MergePlan plan = merger.plan(ImportMode.DISTRIBUTE, existing(8), incoming(2));

        assertEquals(10, plan.size());
        assertEquals(List.of(3, 6), plan.newFileIndices());
        List<Path> order = plan.sourcesInOrder();
        assertEquals(Path.of("new-0.jpg"), order.get(3));
        assertEquals(Path.of("new-1.jpg"), order.get(6));
        assertEquals(PhotoEntry.file(Path.of("old-2.jpg"), 0).getPath(), order.get(2));
        assertEquals(PhotoEntry.file(Path.of("old-3.jpg"), 0).getPath(), order.get(4));
    }

    @Test
    void distributedIndicesFollowTheFormula() {
        assertArrayEquals(new int[]{3, 6}, BatchMerger.distributedIndices(2, 10));
        assertArrayEquals(new int[]{0, 1, 2}, BatchMerger.distributedIndices(3, 3));
        assertArrayEquals(new int[]{1}, BatchMerger.distributedIndices(1, 3));
        assertArrayEquals(new int[0], BatchMerger.distributedIndices(0, 5));
    }

    @Test
    void distributeIntoEmptyBatchKeepsIncomingOrder() {
        MergePlan plan = merger.planDistribute(List.of(), incoming(3));
        assertEquals(incoming(3), plan.sourcesInOrder());
        assertEquals(List.of(0, 1, 2), plan.newFileIndices());
    }

    @Test
    void appendPutsNewFilesAfterExistingOnes() {
        MergePlan plan = merger.plan(ImportMode.APPEND, existing(3), incoming(2));
        assertEquals(List.of(3, 4), plan.newFileIndices());
        assertEquals(3, plan.existingFiles().size());
    }

    @Test
    void existingEntriesFollowDisplayOrderAndSkipFolders() {
        List<PhotoEntry> entries = new ArrayList<>(existing(2));
        entries.get(0).setDisplayOrder(5);
        entries.add(PhotoEntry.container(Path.of("album"), 0));

        MergePlan plan = merger.planAppend(entries, incoming(1));

        assertEquals(3, plan.size());
        assertEquals(entries.get(1).getPath(), plan.sourcesInOrder().get(0));
        assertEquals(entries.get(0).getPath(), plan.sourcesInOrder().get(1));
    }

    @Test
    void importModeParsesIgnoringCase() {
        assertEquals(ImportMode.DISTRIBUTE, ImportMode.parse(" distribute "));
        assertEquals(ImportMode.APPEND, ImportMode.parse("Append"));
    }
}
