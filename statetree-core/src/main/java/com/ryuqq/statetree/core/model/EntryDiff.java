package com.ryuqq.statetree.core.model;

import com.ryuqq.statetree.core.exception.MalformedEntryException;

import java.util.List;

/**
 * Outcome of diffing an Entry Collection against a new sequence, classified by identity key.
 *
 * @param added keys present only in the new sequence
 * @param updated keys present in both whose record content differs
 * @param removed keys present only in the old sequence
 * @param reordered true when the surviving keys changed relative order
 * @param rejected records skipped because they had no usable key
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public record EntryDiff(
    List<String> added,
    List<String> updated,
    List<String> removed,
    boolean reordered,
    List<MalformedEntryException> rejected
) {

    private static final EntryDiff NONE = new EntryDiff(List.of(), List.of(), List.of(), false, List.of());

    public EntryDiff {
        added = List.copyOf(added);
        updated = List.copyOf(updated);
        removed = List.copyOf(removed);
        rejected = List.copyOf(rejected);
    }

    public static EntryDiff none() {
        return NONE;
    }

    public static EntryDiff added(String key) {
        return new EntryDiff(List.of(key), List.of(), List.of(), false, List.of());
    }

    public static EntryDiff updated(String key) {
        return new EntryDiff(List.of(), List.of(key), List.of(), false, List.of());
    }

    public static EntryDiff removed(String key) {
        return new EntryDiff(List.of(), List.of(), List.of(key), false, List.of());
    }

    /**
     * Whether the collection content changed. Rejected records alone are not a change.
     *
     * @return true if anything was added, updated, removed or reordered
     */
    public boolean hasChanges() {
        return !added.isEmpty() || !updated.isEmpty() || !removed.isEmpty() || reordered;
    }
}
