package com.ryuqq.statetree.core.tree;

import com.ryuqq.statetree.core.event.ChangeEvent;
import com.ryuqq.statetree.core.event.ChangeListener;
import com.ryuqq.statetree.core.event.ErrorObservers;
import com.ryuqq.statetree.core.exception.DispatchOverflowException;
import com.ryuqq.statetree.core.model.EventKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 트리 하나의 변경 알림을 수집하고 발행하는 디스패처.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * mutate(...) 호출 (가장 바깥 호출이 패스를 엶)
 *   ↓
 * 1. Collect: 리프 변경을 DispatchPass에 기록 (알림 없음)
 *   ↓ (가장 바깥 호출 종료)
 * 2. Emit-local: 변경된 리프마다 change:&lt;key&gt; 각 1회, change 1회
 *   ↓
 * 3. Bubble: 조상마다 상대 경로의 모든 접두사에 대해 change:&lt;path&gt; 각 1회, change 1회
 *    (깊은 레벨부터 루트 방향으로)
 *   ↓
 * 4. 리스너가 일으킨 변경은 새 패스로 큐잉 → 현재 패스 완료 후 발행
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>한 패스에서 리스너 하나는 스코프마다 최대 1회 호출</li>
 *   <li>변경이 없는 패스는 아무것도 발행하지 않음</li>
 *   <li>패스는 중첩되지 않음 (재진입 시 큐잉)</li>
 *   <li>리스너 예외는 해당 리스너에서 격리되어 ErrorObservers로 보고</li>
 * </ul>
 */
final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final DispatchConfig config;
    private final Deque<DispatchPass> queued = new ArrayDeque<>();
    private final List<Runnable> deferred = new ArrayList<>();
    private DispatchPass open;
    private boolean draining;

    Dispatcher(DispatchConfig config) {
        this.config = config;
    }

    DispatchConfig config() {
        return config;
    }

    /**
     * Runs a mutation inside a dispatch pass.
     *
     * <p>Nested calls join the pass opened by the outermost call. When the outermost call returns
     * (normally or not) the pass is queued and, unless a drain is already running further up the
     * stack, drained immediately.</p>
     */
    <T> T mutate(Function<DispatchPass, T> mutation) {
        boolean outermost = open == null;
        if (outermost) {
            open = new DispatchPass();
        }
        try {
            return mutation.apply(open);
        } finally {
            if (outermost) {
                DispatchPass pass = open;
                open = null;
                pass.seal();
                if (!pass.isEmpty()) {
                    queued.add(pass);
                }
                if (!draining) {
                    drain();
                }
            }
        }
    }

    /**
     * Runs {@code action} now, or after the current pass if one is emitting.
     */
    void whenIdle(Runnable action) {
        if (draining) {
            deferred.add(action);
        } else {
            action.run();
        }
    }

    private void drain() {
        draining = true;
        try {
            int followUps = -1;
            DispatchPass pass;
            while ((pass = queued.poll()) != null) {
                if (++followUps > config.maxCascadePasses()) {
                    int dropped = queued.size() + 1;
                    queued.clear();
                    ErrorObservers.report(null, new DispatchOverflowException(config.maxCascadePasses(), dropped));
                    break;
                }
                emit(pass);
                runDeferred();
            }
        } finally {
            // passes left behind by a fatal error must not leak into the next drain
            queued.clear();
            draining = false;
            runDeferred();
        }
    }

    private void runDeferred() {
        if (deferred.isEmpty()) {
            return;
        }
        List<Runnable> actions = new ArrayList<>(deferred);
        deferred.clear();
        actions.forEach(Runnable::run);
    }

    private void emit(DispatchPass pass) {
        Map<ModelComponent, Scope> scopes = new LinkedHashMap<>();

        for (DispatchPass.LeafChange change : pass.changes()) {
            ModelComponent leaf = change.component;
            if (leaf.tree.isClosed()) {
                return;
            }

            Scope local = scopes.computeIfAbsent(leaf, Scope::new);
            change.attributes.forEach((key, value) -> local.add(EventKey.CHANGE.child(key), key, value));

            List<ModelComponent> chain = new ArrayList<>();
            chain.add(leaf);
            for (ObservableNode ancestor = leaf.parent(); ancestor != null; ancestor = ancestor.parent()) {
                Scope scope = scopes.computeIfAbsent(ancestor, Scope::new);
                EventKey base = leaf.keyRelativeTo(leaf.level() - ancestor.level());
                change.attributes.forEach((key, value) -> scope.add(base.child(key), key, value));
                for (ModelComponent component : chain) {
                    if (!component.isInline()) {
                        scope.add(component.keyRelativeTo(component.level() - ancestor.level()), null,
                            component.eventValue(pass));
                    }
                }
                chain.add(ancestor);
            }
        }

        List<Scope> ordered = new ArrayList<>(scopes.values());
        ordered.sort(Comparator.comparingInt((Scope s) -> s.component.level()).reversed());

        int delivered = 0;
        for (Scope scope : ordered) {
            for (Map.Entry<EventKey, Qualified> entry : scope.qualified.entrySet()) {
                Qualified q = entry.getValue();
                delivered += fire(scope.component, new ChangeEvent(entry.getKey(), scope.component, q.attribute, q.value));
            }
            delivered += fire(scope.component, new ChangeEvent(EventKey.CHANGE, scope.component, null, scope.component));
        }

        if (log.isDebugEnabled()) {
            log.debug("Dispatch pass emitted: {} changed leaves, {} scopes, {} listener calls",
                pass.size(), ordered.size(), delivered);
        }
    }

    private int fire(ModelComponent component, ChangeEvent event) {
        List<ChangeListener> listeners = component.listeners().get(event.key());
        for (ChangeListener listener : listeners) {
            try {
                listener.onChange(event);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                ErrorObservers.report(event, e);
            }
        }
        return listeners.size();
    }

    /**
     * Events one component fires in a pass. Qualified keys keep first-seen order.
     */
    private static final class Scope {

        private final ModelComponent component;
        private final Map<EventKey, Qualified> qualified = new LinkedHashMap<>();

        Scope(ModelComponent component) {
            this.component = component;
        }

        void add(EventKey key, String attribute, Object value) {
            if (!key.isGeneric()) {
                qualified.putIfAbsent(key, new Qualified(attribute, value));
            }
        }
    }

    private record Qualified(String attribute, Object value) {
    }
}
