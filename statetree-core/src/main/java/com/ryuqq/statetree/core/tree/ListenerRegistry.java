package com.ryuqq.statetree.core.tree;

import com.ryuqq.statetree.core.event.ChangeEvent;
import com.ryuqq.statetree.core.event.ChangeListener;
import com.ryuqq.statetree.core.model.EventKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Listeners of one component, grouped by event key.
 *
 * <p>Not thread-safe. Changes requested while a pass is emitting are routed through
 * {@link Dispatcher#whenIdle(Runnable)} by the owning component.</p>
 */
final class ListenerRegistry {

    private final Map<EventKey, List<ChangeListener>> listeners = new HashMap<>();

    void add(EventKey key, ChangeListener listener) {
        listeners.computeIfAbsent(key, k -> new ArrayList<>()).add(listener);
    }

    void remove(EventKey key, ChangeListener listener) {
        List<ChangeListener> registered = listeners.get(key);
        if (registered == null) {
            return;
        }
        registered.removeIf(l -> l == listener || (l instanceof OnceListener && ((OnceListener) l).delegate == listener));
        if (registered.isEmpty()) {
            listeners.remove(key);
        }
    }

    void clear() {
        listeners.clear();
    }

    List<ChangeListener> get(EventKey key) {
        List<ChangeListener> registered = listeners.get(key);
        return registered == null ? List.of() : List.copyOf(registered);
    }

    int count(EventKey key) {
        List<ChangeListener> registered = listeners.get(key);
        return registered == null ? 0 : registered.size();
    }

    /**
     * Wrapper installed by {@code once}; unregisters itself before delegating.
     */
    static final class OnceListener implements ChangeListener {

        private final ModelComponent owner;
        private final EventKey key;
        private final ChangeListener delegate;
        private boolean fired;

        OnceListener(ModelComponent owner, EventKey key, ChangeListener delegate) {
            this.owner = owner;
            this.key = key;
            this.delegate = delegate;
        }

        @Override
        public void onChange(ChangeEvent event) {
            if (fired) {
                return;
            }
            fired = true;
            owner.off(key, this);
            delegate.onChange(event);
        }
    }
}
