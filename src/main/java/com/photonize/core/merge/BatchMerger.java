package com.photonize.core.merge;

import com.photonize.core.model.PhotoEntry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Works out where incoming files land among an existing ordered batch. Pure computation: touches
 * neither the disk nor the entries.
 */
public final class BatchMerger {

    public MergePlan plan(ImportMode mode, List<PhotoEntry> existing, List<Path> newFiles) {
        if (mode == ImportMode.DISTRIBUTE) {
            return planDistribute(existing, newFiles);
        }
        return planAppend(existing, newFiles);
    }

    public MergePlan planAppend(List<PhotoEntry> existing, List<Path> newFiles) {
        List<Path> old = existingInOrder(existing);
        List<Path> incoming = newFiles == null ? List.of() : newFiles;
        List<MergeSlot> slots = new ArrayList<>(old.size() + incoming.size());
        for (int i = 0; i < old.size(); i++) {
            slots.add(new MergeSlot(old.get(i), false, i));
        }
        for (int i = 0; i < incoming.size(); i++) {
            slots.add(new MergeSlot(incoming.get(i), true, old.size() + i));
        }
        return new MergePlan(slots);
    }

    /**
     * New file {@code i} of {@code n} goes to {@code floor((i + 1) * total / (n + 1))}; existing
     * entries fill the remaining positions in their current order.
     */
    public MergePlan planDistribute(List<PhotoEntry> existing, List<Path> newFiles) {
        List<Path> old = existingInOrder(existing);
        List<Path> incoming = newFiles == null ? List.of() : newFiles;
        int newCount = incoming.size();
        int total = old.size() + newCount;

        int[] insertAt = distributedIndices(newCount, total);
        List<MergeSlot> slots = new ArrayList<>(total);
        int oldIdx = 0;
        int newIdx = 0;
        for (int finalIdx = 0; finalIdx < total; finalIdx++) {
            if (newIdx < newCount && insertAt[newIdx] == finalIdx) {
                slots.add(new MergeSlot(incoming.get(newIdx), true, finalIdx));
                newIdx++;
            } else {
                slots.add(new MergeSlot(old.get(oldIdx), false, finalIdx));
                oldIdx++;
            }
        }
        return new MergePlan(slots);
    }

    static int[] distributedIndices(int newCount, int total) {
        int[] positions = new int[newCount];
        for (int i = 0; i < newCount; i++) {
            positions[i] = (int) ((long) (i + 1) * total / (newCount + 1));
        }
        return positions;
    }

    private static List<Path> existingInOrder(List<PhotoEntry> existing) {
        if (existing == null) {
            return List.of();
        }
        return existing.stream()
            .filter(e -> !e.isContainer())
            .sorted(Comparator.comparingInt(PhotoEntry::getDisplayOrder))
            .map(PhotoEntry::getPath)
            .toList();
    }
}
