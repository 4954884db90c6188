package com.ryuqq.statetree.core.tree;

import com.ryuqq.statetree.core.exception.MalformedEntryException;
import com.ryuqq.statetree.core.model.Entry;
import com.ryuqq.statetree.core.model.EntryDiff;
import com.ryuqq.statetree.core.model.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 하나의 디스패치 패스 동안 누적되는 변경 목록.
 *
 * <p>외부 변경 호출 하나(set, replaceAll, replace, batch)가 패스 하나를 엽니다.
 * 호출이 진행되는 동안 변경된 리프와 키가 이곳에 기록되며 알림은 발행되지 않습니다.
 * 가장 바깥 호출이 끝나면 {@link #seal()}로 순 변화를 확정하고 {@link Dispatcher}가 발행합니다.</p>
 *
 * <p><strong>순 변화 규칙:</strong></p>
 * <ul>
 *   <li>속성 키는 패스 시작 시점 값과 비교 (바꿨다가 되돌리면 변경 없음)</li>
 *   <li>컬렉션은 패스 시작 시점 레코드와 비교해 {@link EntryDiff}를 계산
 *       (삭제 후 같은 레코드를 다시 넣으면 변경 없음)</li>
 *   <li>순 변화가 없는 리프는 패스에서 제외</li>
 * </ul>
 */
final class DispatchPass {

    private final Map<ModelComponent, LeafChange> changes = new LinkedHashMap<>();

    /**
     * @param previous 변경 직전 값 (없었으면 null)
     * @param newValue 새 값 (제거면 null)
     */
    void recordAttribute(AttributeSet set, String key, Object previous, Object newValue) {
        LeafChange change = changes.computeIfAbsent(set, LeafChange::new);
        if (!change.attributesBefore.containsKey(key)) {
            change.attributesBefore.put(key, previous);
        }
        if (Values.deepEquals(change.attributesBefore.get(key), newValue)) {
            change.attributes.remove(key);
        } else {
            change.attributes.put(key, newValue);
        }
    }

    /**
     * 컬렉션 변경 직전에 호출. 패스에서 처음 바뀌는 컬렉션이면 현재 레코드를 보관합니다.
     *
     * @param currentItems 변경 직전 레코드
     * @param rejected 이번 호출에서 거부된 레코드
     */
    void collectionChanging(EntryCollection collection, Map<String, Entry> currentItems,
                            List<MalformedEntryException> rejected) {
        LeafChange change = changes.computeIfAbsent(collection, LeafChange::new);
        if (change.itemsBefore == null) {
            change.itemsBefore = new LinkedHashMap<>(currentItems);
        }
        change.rejected.addAll(rejected);
    }

    /**
     * 컬렉션 순 변화를 계산하고 순 변화가 없는 리프를 제거합니다.
     */
    void seal() {
        for (LeafChange change : changes.values()) {
            if (change.itemsBefore != null) {
                EntryCollection collection = (EntryCollection) change.component;
                change.diff = EntryCollection.diff(change.itemsBefore, collection.items(), change.rejected);
            }
        }
        changes.values().removeIf(LeafChange::cancelledOut);
    }

    EntryDiff diffFor(EntryCollection collection) {
        LeafChange change = changes.get(collection);
        return change == null ? null : change.diff;
    }

    Collection<LeafChange> changes() {
        return changes.values();
    }

    boolean isEmpty() {
        return changes.isEmpty();
    }

    int size() {
        return changes.size();
    }

    /**
     * 리프 하나의 변경 내용.
     */
    static final class LeafChange {

        final ModelComponent component;
        final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, Object> attributesBefore = new LinkedHashMap<>();
        private final List<MalformedEntryException> rejected = new ArrayList<>();
        private Map<String, Entry> itemsBefore;
        EntryDiff diff;

        LeafChange(ModelComponent component) {
            this.component = component;
        }

        private boolean cancelledOut() {
            return attributes.isEmpty() && (diff == null || !diff.hasChanges());
        }
    }
}
