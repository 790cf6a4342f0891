package com.photonize.core.merge;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Final layout of a merged batch. Slots are sorted by index and cover {@code 0..size()-1}
 * with no gaps and no repeats.
 */
public final class MergePlan {
    private final List<MergeSlot> slots;

    public MergePlan(List<MergeSlot> slots) {
        List<MergeSlot> sorted = new ArrayList<>(slots);
        sorted.sort(Comparator.comparingInt(MergeSlot::finalIndex));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).finalIndex() != i) {
                throw new IllegalArgumentException("Merge slots must cover 0.." + (sorted.size() - 1)
                    + " exactly; found index " + sorted.get(i).finalIndex() + " at position " + i);
            }
        }
        this.slots = List.copyOf(sorted);
    }

    public List<MergeSlot> slots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public List<MergeSlot> newFiles() {
        return slots.stream().filter(MergeSlot::newFile).toList();
    }

    public List<MergeSlot> existingFiles() {
        return slots.stream().filter(s -> !s.newFile()).toList();
    }

    public List<Integer> newFileIndices() {
        return newFiles().stream().map(MergeSlot::finalIndex).toList();
    }

    public List<Path> sourcesInOrder() {
        return slots.stream().map(MergeSlot::sourcePath).toList();
    }
}
