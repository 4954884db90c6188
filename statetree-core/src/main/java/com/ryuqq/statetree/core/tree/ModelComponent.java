package com.ryuqq.statetree.core.tree;

import com.ryuqq.statetree.core.event.ChangeListener;
import com.ryuqq.statetree.core.model.EventKey;
import com.ryuqq.statetree.core.model.Path;

/**
 * 트리를 구성하는 모든 컴포넌트의 공통 기반.
 *
 * <p>컴포넌트는 세 종류입니다:</p>
 * <ul>
 *   <li>{@link AttributeSet}: 키/값 속성 (리프)</li>
 *   <li>{@link EntryCollection}: key로 식별되는 레코드 시퀀스 (리프)</li>
 *   <li>{@link ObservableNode}: 하위 컴포넌트를 조합하는 노드</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>부모는 최대 하나이며 생성 시점에 고정됨 (재배치 불가)</li>
 *   <li>부모 참조는 트리 arena의 id로만 보관 (참조 순환 없음)</li>
 *   <li>조상 기준 상대 이벤트 키는 생성 시점에 한 번 계산</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public abstract sealed class ModelComponent permits AttributeSet, EntryCollection, ObservableNode {

    final ModelTree tree;
    private final int id;
    private final int parentId;
    private final String name;
    private final Path path;
    private final int level;
    private final ListenerRegistry listeners = new ListenerRegistry();

    /**
     * ancestorKeys[i]: 이 컴포넌트의 (i+1)번째 조상 기준 상대 이벤트 키.
     */
    private final EventKey[] ancestorKeys;

    /**
     * @param tree 소속 arena
     * @param parent 부모 노드 (루트는 null)
     * @param name 경로 세그먼트 (인라인 속성 집합은 null)
     */
    ModelComponent(ModelTree tree, ObservableNode parent, String name) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        if (name != null) {
            Path.requireSegment(name);
        }
        this.tree = tree;
        this.name = name;
        if (parent == null) {
            this.parentId = -1;
            this.path = Path.empty();
            this.level = 0;
            this.ancestorKeys = new EventKey[0];
        } else {
            ModelComponent owner = parent;
            this.parentId = owner.id;
            this.path = name == null ? owner.path : owner.path.child(name);
            this.level = owner.level + 1;
            this.ancestorKeys = new EventKey[level];
            EventKey relative = name == null ? EventKey.CHANGE : EventKey.CHANGE.child(name);
            ModelComponent ancestor = owner;
            for (int i = 0; i < level; i++) {
                ancestorKeys[i] = relative;
                if (ancestor.name != null) {
                    relative = EventKey.CHANGE.child(ancestor.name).resolve(relative);
                }
                ancestor = ancestor.parent();
            }
        }
        this.id = tree.register(this);
    }

    /**
     * 경로 세그먼트.
     *
     * @return 이름 (루트 노드의 이름 포함; 인라인 속성 집합은 null)
     */
    public String name() {
        return name;
    }

    /**
     * 루트 기준 절대 경로. 루트 자신의 이름은 경로에 포함되지 않습니다.
     *
     * @return 절대 경로
     */
    public Path path() {
        return path;
    }

    /**
     * 부모 노드.
     *
     * @return 부모 (루트이거나 트리가 닫힌 경우 null)
     */
    public ObservableNode parent() {
        return (ObservableNode) tree.lookup(parentId);
    }

    /**
     * Registers a listener for {@code change} or {@code change:<dotted.path>}.
     *
     * <p>Called while a pass is emitting, the registration takes effect after that pass.</p>
     *
     * @param eventName event name
     * @param listener callback
     * @throws IllegalArgumentException if the name is malformed or the listener is null
     */
    public void on(String eventName, ChangeListener listener) {
        EventKey key = EventKey.parse(eventName);
        requireListener(listener);
        tree.dispatcher().whenIdle(() -> listeners.add(key, listener));
    }

    /**
     * Registers a listener that is removed after its first call.
     *
     * @param eventName event name
     * @param listener callback
     */
    public void once(String eventName, ChangeListener listener) {
        EventKey key = EventKey.parse(eventName);
        requireListener(listener);
        ListenerRegistry.OnceListener wrapper = new ListenerRegistry.OnceListener(this, key, listener);
        tree.dispatcher().whenIdle(() -> listeners.add(key, wrapper));
    }

    /**
     * Removes every registration of {@code listener} under {@code eventName}.
     *
     * @param eventName event name
     * @param listener callback passed to {@link #on} or {@link #once}
     */
    public void off(String eventName, ChangeListener listener) {
        off(EventKey.parse(eventName), listener);
    }

    void off(EventKey key, ChangeListener listener) {
        requireListener(listener);
        tree.dispatcher().whenIdle(() -> listeners.remove(key, listener));
    }

    /**
     * Number of listeners currently registered under {@code eventName}.
     *
     * @param eventName event name
     * @return listener count
     */
    public int listenerCount(String eventName) {
        return listeners.count(EventKey.parse(eventName));
    }

    ListenerRegistry listeners() {
        return listeners;
    }

    int level() {
        return level;
    }

    /**
     * Event key of this component relative to an ancestor {@code hops} levels up.
     */
    EventKey keyRelativeTo(int hops) {
        return ancestorKeys[hops - 1];
    }

    boolean isInline() {
        return name == null && parentId >= 0;
    }

    /**
     * Value carried by qualified events whose path ends at this component.
     */
    abstract Object eventValue(DispatchPass pass);

    /**
     * Plain-data copy of this component's state.
     *
     * @return snapshot value (map or list)
     */
    public abstract Object toSnapshot();

    private static void requireListener(ChangeListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + (path.isEmpty() ? (name == null ? "" : name) : path.toString()) + '}';
    }
}
