package com.ryuqq.statetree.core.exception;

import com.ryuqq.statetree.core.model.Path;

/**
 * Raised for a collection record that has no usable identity {@code key}, or whose key repeats
 * one seen earlier in the same batch.
 *
 * <p>During {@code replaceAll} the offending record is skipped and this exception is reported to
 * the error observer; the rest of the batch is applied.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public class MalformedEntryException extends StateTreeException {

    private final Path collectionPath;
    private final int index;
    private final transient Object entry;

    /**
     * @param collectionPath path of the collection the record was meant for
     * @param index position of the record in the source sequence (-1 for single-record calls)
     * @param entry the rejected record as received
     * @param message reason
     */
    public MalformedEntryException(Path collectionPath, int index, Object entry, String message) {
        super(message + " (collection: " + collectionPath + ", index: " + index + ")");
        this.collectionPath = collectionPath;
        this.index = index;
        this.entry = entry;
    }

    public Path getCollectionPath() {
        return collectionPath;
    }

    public int getIndex() {
        return index;
    }

    public Object getEntry() {
        return entry;
    }
}
