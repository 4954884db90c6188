package com.ryuqq.statetree.device;

import com.ryuqq.statetree.core.model.Entry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 기능 토글 하나 (features 컬렉션의 레코드를 타입으로 본 것).
 *
 * <p>서버는 값을 문자열 {@code val}로 보냅니다. {@code value}는 그 문자열을 해석한 값입니다:</p>
 * <ul>
 *   <li>"true" / "false" → Boolean</li>
 *   <li>숫자 형태 → Long 또는 Double</li>
 *   <li>그 외 → 문자열 그대로</li>
 * </ul>
 *
 * @param key 기능 식별자
 * @param val 서버가 보낸 원본 문자열
 * @param value 해석된 값
 * @param mutable 사용자가 변경할 수 있는지 여부
 * @param lastModified 마지막 변경 시각 (ISO-8601 문자열, nullable)
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public record Feature(
    String key,
    String val,
    Object value,
    boolean mutable,
    String lastModified
) {

    public Feature {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    /**
     * val로부터 value를 해석해 Feature 생성.
     *
     * @param key 기능 식별자
     * @param val 원본 문자열
     * @param mutable 변경 가능 여부
     * @return Feature 인스턴스
     */
    public static Feature of(String key, String val, boolean mutable) {
        return new Feature(key, val, parseValue(val), mutable, null);
    }

    /**
     * 컬렉션 레코드를 Feature로 변환.
     *
     * <p>{@code value} 필드가 없으면 {@code val}을 해석합니다.</p>
     *
     * @param entry 컬렉션 레코드
     * @return Feature 인스턴스
     */
    public static Feature from(Entry entry) {
        Object rawVal = entry.get("val");
        String val = rawVal == null ? null : rawVal.toString();
        Object value = entry.fields().containsKey("value") ? entry.get("value") : parseValue(val);
        Object mutable = entry.get("mutable");
        Object lastModified = entry.get("lastModified");
        return new Feature(
            entry.key(),
            val,
            value,
            Boolean.TRUE.equals(mutable),
            lastModified == null ? null : lastModified.toString()
        );
    }

    /**
     * 서버 문자열 값 해석.
     *
     * @param val 원본 문자열 (nullable)
     * @return Boolean, Long, Double 또는 원본 문자열
     */
    public static Object parseValue(String val) {
        if (val == null) {
            return null;
        }
        if ("true".equalsIgnoreCase(val)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(val)) {
            return Boolean.FALSE;
        }
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException ignored) {
            // not an integer
        }
        try {
            double d = Double.parseDouble(val);
            if (!Double.isNaN(d) && !Double.isInfinite(d)) {
                return d;
            }
        } catch (NumberFormatException ignored) {
            // not a number
        }
        return val;
    }

    /**
     * 값이 true인지 확인 (토글 검사용).
     *
     * @return value가 Boolean.TRUE이면 true
     */
    public boolean isEnabled() {
        return Boolean.TRUE.equals(value);
    }

    /**
     * 컬렉션에 넣을 레코드 형태로 변환.
     *
     * @return key, val, value, mutable, lastModified(있는 경우)
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("key", key);
        record.put("val", val);
        record.put("value", value);
        record.put("mutable", mutable);
        if (lastModified != null) {
            record.put("lastModified", lastModified);
        }
        return record;
    }
}
