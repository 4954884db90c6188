package com.ryuqq.statetree.core.model;

import java.util.List;
import java.util.Map;

/**
 * 속성 값의 타입 가드.
 *
 * <p>AttributeSet에 스키마가 지정된 경우 각 키의 값은 해당 타입을 만족해야 합니다.
 * null은 "키 제거"를 의미하므로 모든 타입에서 허용됩니다.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public enum AttributeType {

    /**
     * 문자열.
     */
    STRING,

    /**
     * 숫자 (Integer, Long, Double, BigDecimal 등).
     */
    NUMBER,

    /**
     * 불리언.
     */
    BOOLEAN,

    /**
     * 문자열 키를 갖는 Map.
     */
    OBJECT,

    /**
     * List.
     */
    LIST,

    /**
     * 제한 없음.
     */
    ANY;

    /**
     * 값이 이 타입을 만족하는지 확인.
     *
     * @param value 검사할 값 (null 허용)
     * @return 만족하면 true
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map;
            case LIST -> value instanceof List;
            case ANY -> true;
        };
    }
}
