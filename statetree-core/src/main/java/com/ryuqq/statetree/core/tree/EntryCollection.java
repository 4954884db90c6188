package com.ryuqq.statetree.core.tree;

import com.ryuqq.statetree.core.event.ErrorObservers;
import com.ryuqq.statetree.core.exception.MalformedEntryException;
import com.ryuqq.statetree.core.exception.ValidationException;
import com.ryuqq.statetree.core.model.Entry;
import com.ryuqq.statetree.core.model.EntryDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered sequence of records identified by their {@code key} field.
 *
 * <p>Diffing is always by identity key, never by position: replacing element <i>i</i> with a
 * record carrying another key reads as "remove old key, add new key". Order is the source order of
 * the last {@link #replaceAll(List)}; a pure reorder counts as a change.</p>
 *
 * <p>Every mutating call produces one {@code change} at this scope and one per ancestor scope,
 * however many records it touched.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class EntryCollection extends ModelComponent {

    private static final Logger log = LoggerFactory.getLogger(EntryCollection.class);

    private final LinkedHashMap<String, Entry> items = new LinkedHashMap<>();

    EntryCollection(ModelTree tree, ObservableNode owner, String name) {
        super(tree, owner, name);
    }

    public Entry get(String key) {
        return items.get(key);
    }

    public boolean contains(String key) {
        return items.containsKey(key);
    }

    public List<String> keys() {
        return List.copyOf(items.keySet());
    }

    public List<Entry> entries() {
        return List.copyOf(items.values());
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Replaces the whole sequence, diffing by {@code key}.
     *
     * <p>Records without a string {@code key}, or repeating a key already seen in this batch, are
     * skipped and reported to {@link ErrorObservers}; the rest of the batch is applied.</p>
     *
     * @param newItems records in their new order
     * @return classification of every key touched
     */
    public EntryDiff replaceAll(List<?> newItems) {
        tree.checkOpen();
        if (newItems == null) {
            throw new IllegalArgumentException("newItems cannot be null");
        }
        return tree.dispatcher().mutate(pass -> applyAll(newItems, pass));
    }

    /**
     * Inserts a record, or updates the record with the same key.
     *
     * @param record record with a string {@code key}
     * @return true if the collection changed
     * @throws MalformedEntryException if the record has no usable key
     */
    public boolean upsert(Map<String, ?> record) {
        tree.checkOpen();
        Entry entry = parse(record, -1);
        return tree.dispatcher().mutate(pass -> {
            Entry previous = items.get(entry.key());
            if (previous != null && previous.contentEquals(entry)) {
                return false;
            }
            pass.collectionChanging(this, items, List.of());
            items.put(entry.key(), entry);
            return true;
        });
    }

    /**
     * Appends a record whose key is not present yet.
     *
     * @param record record with a string {@code key}
     * @throws MalformedEntryException if the record has no usable key
     * @throws ValidationException if the key already exists
     */
    public void add(Map<String, ?> record) {
        tree.checkOpen();
        Entry entry = parse(record, -1);
        if (items.containsKey(entry.key())) {
            throw new ValidationException(path(), "Entry '" + entry.key() + "' already exists");
        }
        upsert(entry.fields());
    }

    /**
     * Removes the record with the given key.
     *
     * @param key identity key
     * @return true if a record was removed
     */
    public boolean removeByKey(String key) {
        tree.checkOpen();
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return tree.dispatcher().mutate(pass -> {
            if (!items.containsKey(key)) {
                return false;
            }
            pass.collectionChanging(this, items, List.of());
            items.remove(key);
            return true;
        });
    }

    @Override
    Object eventValue(DispatchPass pass) {
        EntryDiff diff = pass.diffFor(this);
        return diff == null ? EntryDiff.none() : diff;
    }

    @Override
    public List<Object> toSnapshot() {
        List<Object> snapshot = new ArrayList<>(items.size());
        items.values().forEach(e -> snapshot.add(e.fields()));
        return Collections.unmodifiableList(snapshot);
    }

    EntryDiff applyAll(List<?> newItems, DispatchPass pass) {
        List<MalformedEntryException> rejected = new ArrayList<>();
        LinkedHashMap<String, Entry> next = new LinkedHashMap<>();
        for (int i = 0; i < newItems.size(); i++) {
            try {
                Entry entry = parse(newItems.get(i), i);
                if (next.containsKey(entry.key())) {
                    throw new MalformedEntryException(path(), i, newItems.get(i), "Duplicate key '" + entry.key() + "'");
                }
                next.put(entry.key(), entry);
            } catch (MalformedEntryException e) {
                rejected.add(e);
                ErrorObservers.report(null, e);
            }
        }

        EntryDiff diff = diff(items, next, rejected);
        if (diff.hasChanges()) {
            pass.collectionChanging(this, items, rejected);
            items.clear();
            items.putAll(next);
            log.debug("{} replaced: {} added, {} updated, {} removed, reordered={}",
                path(), diff.added().size(), diff.updated().size(), diff.removed().size(), diff.reordered());
        }
        return diff;
    }

    /**
     * Live records, for {@link DispatchPass#seal()}.
     */
    Map<String, Entry> items() {
        return items;
    }

    /**
     * Classifies the move from {@code before} to {@code after} by identity key.
     */
    static EntryDiff diff(Map<String, Entry> before, Map<String, Entry> after,
                          List<MalformedEntryException> rejected) {
        List<String> added = new ArrayList<>();
        List<String> updated = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (Entry entry : after.values()) {
            Entry previous = before.get(entry.key());
            if (previous == null) {
                added.add(entry.key());
            } else if (!previous.contentEquals(entry)) {
                updated.add(entry.key());
            }
        }
        for (String key : before.keySet()) {
            if (!after.containsKey(key)) {
                removed.add(key);
            }
        }
        boolean reordered = !survivorOrder(before.keySet(), after.keySet())
            .equals(survivorOrder(after.keySet(), before.keySet()));
        return new EntryDiff(added, updated, removed, reordered, rejected);
    }

    private Entry parse(Object record, int index) {
        if (!(record instanceof Map)) {
            throw new MalformedEntryException(path(), index, record, "Record must be an object");
        }
        Object key = ((Map<?, ?>) record).get("key");
        if (!(key instanceof String) || ((String) key).isBlank()) {
            throw new MalformedEntryException(path(), index, record, "Record has no identity key");
        }
        try {
            @SuppressWarnings("unchecked")
            Map<String, ?> fields = (Map<String, ?>) record;
            return Entry.of(fields);
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new MalformedEntryException(path(), index, record, e.getMessage());
        }
    }

    private static List<String> survivorOrder(Set<String> order, Set<String> other) {
        List<String> result = new ArrayList<>();
        Set<String> keep = new HashSet<>(other);
        for (String key : new LinkedHashSet<>(order)) {
            if (keep.contains(key)) {
                result.add(key);
            }
        }
        return result;
    }
}
