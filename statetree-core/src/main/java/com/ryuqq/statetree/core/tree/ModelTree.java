package com.ryuqq.statetree.core.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Arena owning every component of one tree.
 *
 * <p>Components refer to their parent by arena id instead of by reference, so tearing the tree
 * down is a single {@link #close()} and nothing outside the arena keeps the graph reachable.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
final class ModelTree {

    private final List<ModelComponent> components = new ArrayList<>();
    private final Dispatcher dispatcher;
    private boolean closed;

    ModelTree(DispatchConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.dispatcher = new Dispatcher(config);
    }

    int register(ModelComponent component) {
        checkOpen();
        components.add(component);
        return components.size() - 1;
    }

    /**
     * @param id arena id, or -1 for "no component"
     * @return the component, or null once the tree is closed
     */
    ModelComponent lookup(int id) {
        if (id < 0 || closed) {
            return null;
        }
        return components.get(id);
    }

    Dispatcher dispatcher() {
        return dispatcher;
    }

    void checkOpen() {
        if (closed) {
            throw new IllegalStateException("State tree has been closed");
        }
    }

    boolean isClosed() {
        return closed;
    }

    int size() {
        return components.size();
    }

    void close() {
        closed = true;
        components.clear();
    }
}
