package com.photonize.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered collection of {@link PhotoEntry} values as the user sees them.
 * After every mutating call, each entry's display order equals its list position.
 */
public final class PhotoBatch {
    private final List<PhotoEntry> entries = new ArrayList<>();

    public PhotoBatch() {
    }

    public PhotoBatch(List<PhotoEntry> initial) {
        replaceAll(initial);
    }

    /**
     * Replaces the whole collection, ordered by the incoming display orders (stable).
     */
    public void replaceAll(List<PhotoEntry> replacement) {
        entries.clear();
        if (replacement != null) {
            List<PhotoEntry> sorted = new ArrayList<>(replacement);
            sorted.sort(Comparator.comparingInt(PhotoEntry::getDisplayOrder));
            entries.addAll(sorted);
        }
        renumber();
    }

    /**
     * Moves {@code items} so the first of them lands at {@code insertIndex}, measured against the
     * list before the move. Moved items keep their relative order; unknown items are ignored.
     */
    public void move(List<PhotoEntry> items, int insertIndex) {
        if (items == null || items.isEmpty()) {
            return;
        }
        Map<PhotoEntry, Integer> positions = new IdentityHashMap<>();
        for (PhotoEntry item : items) {
            int index = indexOf(item);
            if (index >= 0) {
                positions.put(item, index);
            }
        }
        if (positions.isEmpty()) {
            return;
        }
        List<Map.Entry<PhotoEntry, Integer>> moving = new ArrayList<>(positions.entrySet());
        moving.sort(Map.Entry.comparingByValue());

        int target = Math.max(0, Math.min(insertIndex, entries.size()));
        for (int i = moving.size() - 1; i >= 0; i--) {
            int index = moving.get(i).getValue();
            entries.remove(index);
            if (index < target) {
                target--;
            }
        }
        for (Map.Entry<PhotoEntry, Integer> moved : moving) {
            entries.add(Math.min(target, entries.size()), moved.getKey());
            target++;
        }
        renumber();
    }

    public boolean remove(PhotoEntry entry) {
        int index = indexOf(entry);
        if (index < 0) {
            return false;
        }
        entries.remove(index);
        renumber();
        return true;
    }

    public void renumber() {
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setDisplayOrder(i);
        }
    }

    public List<PhotoEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<PhotoEntry> files() {
        return entries.stream().filter(e -> !e.isContainer()).toList();
    }

    public List<PhotoEntry> containers() {
        return entries.stream().filter(PhotoEntry::isContainer).toList();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private int indexOf(PhotoEntry entry) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == entry) {
                return i;
            }
        }
        return -1;
    }
}
