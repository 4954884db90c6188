package com.ryuqq.statetree.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry Collection의 단일 레코드.
 *
 * <p>레코드의 식별자는 {@code key} 필드이며, 컬렉션 내 위치가 아닙니다.
 * {@code fields}는 {@code key}를 포함한 원본 레코드 전체를 불변 복사본으로 보관합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Entry entry = Entry.of(Map.of("key", "dev-feature", "val", "true", "value", true, "mutable", false));
 * entry.key();            // "dev-feature"
 * entry.get("value");     // true
 * </pre>
 *
 * @param key 식별자
 * @param fields key를 포함한 레코드 필드 (불변)
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public record Entry(
    String key,
    Map<String, Object> fields
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 비어 있거나 fields의 key와 일치하지 않는 경우
     */
    public Entry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>(Values.freezeMap(fields));
        Object declared = copy.putIfAbsent("key", key);
        if (declared != null && !key.equals(declared)) {
            throw new IllegalArgumentException("fields.key (" + declared + ") does not match key (" + key + ")");
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /**
     * 원본 레코드로부터 Entry 생성.
     *
     * @param record {@code key} 문자열 필드를 포함한 레코드
     * @return Entry 인스턴스
     * @throws IllegalArgumentException key가 없거나 문자열이 아닌 경우
     */
    public static Entry of(Map<String, ?> record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Object key = record.get("key");
        if (!(key instanceof String)) {
            throw new IllegalArgumentException("record key must be a string (key: " + key + ")");
        }
        return new Entry((String) key, Values.freezeMap(record));
    }

    /**
     * 필드 값 조회.
     *
     * @param field 필드 이름
     * @return 값 (없으면 null)
     */
    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * 두 레코드의 내용이 구조적으로 같은지 확인.
     *
     * @param other 비교 대상
     * @return key와 모든 필드가 같으면 true
     */
    public boolean contentEquals(Entry other) {
        return other != null && key.equals(other.key) && Values.deepEquals(fields, other.fields);
    }
}
