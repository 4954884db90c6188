package com.ryuqq.statetree.core.tree;

import com.ryuqq.statetree.core.exception.ValidationException;
import com.ryuqq.statetree.core.model.AttributeType;
import com.ryuqq.statetree.core.model.Path;
import com.ryuqq.statetree.core.model.Values;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 키/값 속성의 리프 집합.
 *
 * <p>속성이 바뀌면 {@code change:<key>}와 generic {@code change}가 발행되고,
 * 부모 노드를 거쳐 루트까지 경로가 붙은 이벤트로 전파됩니다.</p>
 *
 * <p><strong>인라인 vs 이름 있는 집합:</strong></p>
 * <ul>
 *   <li>인라인: 모든 {@link ObservableNode}가 하나씩 소유하며 키가 노드 경로 바로 아래에 위치
 *       (device의 {@code url} → device에서 {@code change:url})</li>
 *   <li>이름 있는 집합: 경로 세그먼트를 하나 추가
 *       ({@code addAttributeSet("services")} → device에서 {@code change:services.conversation})</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>null 값을 가진 키는 존재하지 않음 ({@code set(key, null)}은 키 제거)</li>
 *   <li>값은 불변 복사본으로 보관 (외부 Map/List 변경이 상태에 영향 없음)</li>
 *   <li>스키마가 지정된 키는 해당 {@link AttributeType}만 허용</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class AttributeSet extends ModelComponent {

    private final Map<String, Object> entries = new LinkedHashMap<>();
    private final Map<String, AttributeType> schema = new HashMap<>();

    AttributeSet(ModelTree tree, ObservableNode owner, String name) {
        super(tree, owner, name);
    }

    /**
     * 속성 값 조회.
     *
     * @param key 속성 키
     * @return 값 (없으면 null)
     */
    public Object get(String key) {
        return entries.get(key);
    }

    /**
     * 속성 존재 여부.
     *
     * @param key 속성 키
     * @return 존재하면 true
     */
    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
    }

    public int size() {
        return entries.size();
    }

    /**
     * 현재 속성의 불변 복사본.
     *
     * @return key → value
     */
    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * 키의 타입 가드 지정.
     *
     * @param key 속성 키
     * @param type 허용 타입
     * @throws ValidationException 현재 값이 새 타입을 만족하지 않는 경우
     */
    public void define(String key, AttributeType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        requireKey(key);
        if (!type.accepts(entries.get(key))) {
            throw new ValidationException(path(), "Current value of '" + key + "' is not " + type);
        }
        schema.put(key, type);
    }

    /**
     * 키의 타입 가드 조회.
     *
     * @param key 속성 키
     * @return 지정된 타입 (없으면 {@link AttributeType#ANY})
     */
    public AttributeType typeOf(String key) {
        return schema.getOrDefault(key, AttributeType.ANY);
    }

    /**
     * 단일 속성 변경.
     *
     * <p>값이 구조적으로 같으면 아무 이벤트도 발행하지 않습니다. null은 키 제거입니다.</p>
     *
     * @param key 속성 키
     * @param value 새 값
     * @return 실제로 변경되었으면 true
     * @throws ValidationException 키 또는 값이 타입 가드를 통과하지 못한 경우 (변경 없음)
     */
    public boolean set(String key, Object value) {
        tree.checkOpen();
        Object frozen = validate(key, value);
        return tree.dispatcher().mutate(pass -> apply(key, frozen, pass));
    }

    /**
     * 속성 제거.
     *
     * @param key 속성 키
     * @return 키가 존재해서 제거되었으면 true
     */
    public boolean unset(String key) {
        return set(key, null);
    }

    /**
     * 전체 속성 교체.
     *
     * <p>값이 다른 키, 새로 생긴 키, 사라진 키가 모두 변경으로 취급됩니다.
     * 변경된 키마다 {@code change:<key>} 1회, 호출 전체에 대해 {@code change} 1회가 발행됩니다.</p>
     *
     * @param newEntries 새 속성 전체 (null 값의 키는 없는 것으로 취급)
     * @return 하나라도 변경되었으면 true
     * @throws ValidationException 어느 하나라도 검증에 실패한 경우 (아무것도 변경되지 않음)
     */
    public boolean replaceAll(Map<String, ?> newEntries) {
        tree.checkOpen();
        Map<String, Object> frozen = validateAll(newEntries);
        return tree.dispatcher().mutate(pass -> applyAll(frozen, pass));
    }

    @Override
    Object eventValue(DispatchPass pass) {
        return this;
    }

    @Override
    public Map<String, Object> toSnapshot() {
        return toMap();
    }

    Object validate(String key, Object value) {
        try {
            requireKey(key);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(path(), e.getMessage());
        }
        if (isInline() && parent() != null && parent().hasChild(key)) {
            throw new ValidationException(path(), "'" + key + "' names a child component, not an attribute");
        }
        AttributeType type = typeOf(key);
        if (!type.accepts(value)) {
            throw new ValidationException(path(),
                "Attribute '" + key + "' must be " + type + " but was " + value.getClass().getSimpleName());
        }
        try {
            return Values.freeze(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(path(), "Attribute '" + key + "': " + e.getMessage());
        }
    }

    Map<String, Object> validateAll(Map<String, ?> newEntries) {
        if (newEntries == null) {
            throw new IllegalArgumentException("newEntries cannot be null");
        }
        Map<String, Object> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : newEntries.entrySet()) {
            Object value = validate(entry.getKey(), entry.getValue());
            if (value != null) {
                frozen.put(entry.getKey(), value);
            }
        }
        return frozen;
    }

    boolean applyAll(Map<String, Object> frozen, DispatchPass pass) {
        boolean changed = false;
        for (String key : new LinkedHashSet<>(entries.keySet())) {
            if (!frozen.containsKey(key)) {
                changed |= apply(key, null, pass);
            }
        }
        for (Map.Entry<String, Object> entry : frozen.entrySet()) {
            changed |= apply(entry.getKey(), entry.getValue(), pass);
        }
        return changed;
    }

    private boolean apply(String key, Object frozen, DispatchPass pass) {
        Object previous = entries.get(key);
        if (frozen == null) {
            if (!entries.containsKey(key)) {
                return false;
            }
            entries.remove(key);
        } else {
            if (entries.containsKey(key) && Values.deepEquals(entries.get(key), frozen)) {
                return false;
            }
            entries.put(key, frozen);
        }
        pass.recordAttribute(this, key, previous, frozen);
        return true;
    }

    private static void requireKey(String key) {
        Path.requireSegment(key);
    }
}
