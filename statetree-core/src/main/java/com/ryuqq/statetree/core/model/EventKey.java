package com.ryuqq.statetree.core.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Canonical identifier of a change event.
 *
 * <p>An EventKey is the interned form of a relative {@link Path}: every path maps to exactly one
 * instance, so keys can be compared by identity and used as map keys without rebuilding event name
 * strings at dispatch time.</p>
 *
 * <ul>
 *   <li>{@link #CHANGE} - the generic {@code change} event (empty path)</li>
 *   <li>{@code CHANGE.child("features").child("developer")} - {@code change:features.developer}</li>
 * </ul>
 *
 * <p>Keys form a trie rooted at {@link #CHANGE}; children are created on first use and shared
 * by every tree in the process.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class EventKey {

    /**
     * Event name prefix for qualified events.
     */
    public static final String CHANGE_NAME = "change";

    /**
     * The generic change event.
     */
    public static final EventKey CHANGE = new EventKey(null, null);

    private final EventKey parent;
    private final String segment;
    private final int depth;
    private final ConcurrentMap<String, EventKey> children = new ConcurrentHashMap<>();
    private volatile String name;
    private volatile Path path;

    private EventKey(EventKey parent, String segment) {
        this.parent = parent;
        this.segment = segment;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    /**
     * Returns the canonical key for the given relative path.
     *
     * @param path relative path (empty path yields {@link #CHANGE})
     * @return interned key
     * @throws IllegalArgumentException if path is null
     */
    public static EventKey of(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        EventKey key = CHANGE;
        for (String segment : path.segments()) {
            key = key.child(segment);
        }
        return key;
    }

    /**
     * Parses an event name such as {@code change} or {@code change:device.features}.
     *
     * @param eventName event name
     * @return interned key
     * @throws IllegalArgumentException if the name is not a change event name
     */
    public static EventKey parse(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }
        if (eventName.equals(CHANGE_NAME)) {
            return CHANGE;
        }
        if (!eventName.startsWith(CHANGE_NAME + ":") || eventName.length() == CHANGE_NAME.length() + 1) {
            throw new IllegalArgumentException(
                "eventName must be 'change' or 'change:<dotted.path>' (eventName: " + eventName + ")"
            );
        }
        return of(Path.parse(eventName.substring(CHANGE_NAME.length() + 1)));
    }

    /**
     * Returns the interned key one segment below this one.
     *
     * @param segment path segment
     * @return interned child key
     * @throws IllegalArgumentException if the segment is invalid
     */
    public EventKey child(String segment) {
        EventKey existing = children.get(segment);
        if (existing != null) {
            return existing;
        }
        Path.requireSegment(segment);
        return children.computeIfAbsent(segment, s -> new EventKey(this, s));
    }

    /**
     * Returns the key for {@code this + suffix}.
     *
     * @param suffix relative path appended to this key
     * @return interned key
     */
    public EventKey resolve(EventKey suffix) {
        if (suffix.isGeneric()) {
            return this;
        }
        Deque<String> segments = new ArrayDeque<>(suffix.depth);
        for (EventKey k = suffix; k.parent != null; k = k.parent) {
            segments.push(k.segment);
        }
        EventKey key = this;
        for (String s : segments) {
            key = key.child(s);
        }
        return key;
    }

    public EventKey parent() {
        return parent;
    }

    public boolean isGeneric() {
        return parent == null;
    }

    public int depth() {
        return depth;
    }

    /**
     * Relative path this key stands for.
     *
     * @return path (empty for {@link #CHANGE})
     */
    public Path path() {
        Path p = path;
        if (p == null) {
            p = parent == null ? Path.empty() : parent.path().child(segment);
            path = p;
        }
        return p;
    }

    /**
     * Event name, e.g. {@code change:features.developer}. Computed once.
     *
     * @return event name
     */
    public String name() {
        String n = name;
        if (n == null) {
            n = parent == null ? CHANGE_NAME : CHANGE_NAME + ":" + path();
            name = n;
        }
        return n;
    }

    @Override
    public String toString() {
        return name();
    }
}
