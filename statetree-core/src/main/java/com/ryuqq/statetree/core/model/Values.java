package com.ryuqq.statetree.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Structural equality and defensive copying for snapshot values.
 *
 * <p>Values are the JSON-compatible types: {@link String}, {@link Number}, {@link Boolean},
 * {@link Map} with string keys, {@link List}, and {@code null}.</p>
 *
 * <p><strong>Equality rules:</strong></p>
 * <ul>
 *   <li>Numbers compare by numeric value ({@code 1}, {@code 1L} and {@code 1.0} are equal)</li>
 *   <li>Maps compare key by key, ignoring insertion order</li>
 *   <li>Lists compare element by element, in order</li>
 *   <li>Everything else uses {@link Object#equals(Object)}</li>
 * </ul>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public final class Values {

    // Utility class - prevent instantiation
    private Values() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Structural equality of two values.
     *
     * @param a first value
     * @param b second value
     * @return true when both values hold the same data
     */
    public static boolean deepEquals(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b);
        }
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> left = (Map<?, ?>) a;
            Map<?, ?> right = (Map<?, ?>) b;
            if (left.size() != right.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : left.entrySet()) {
                if (!right.containsKey(entry.getKey())) {
                    return false;
                }
                if (!deepEquals(entry.getValue(), right.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List && b instanceof List) {
            List<?> left = (List<?>) a;
            List<?> right = (List<?>) b;
            if (left.size() != right.size()) {
                return false;
            }
            Iterator<?> l = left.iterator();
            Iterator<?> r = right.iterator();
            while (l.hasNext()) {
                if (!deepEquals(l.next(), r.next())) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Immutable deep copy of a value.
     *
     * <p>Maps keep their iteration order; nested maps and lists are copied recursively.</p>
     *
     * @param value value to copy
     * @return immutable copy (immutable scalars as-is, atomic number holders as their current {@code Long})
     * @throws IllegalArgumentException if the value is not JSON-compatible
     */
    public static Object freeze(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            return freezeNumber((Number) value);
        }
        if (value instanceof Map) {
            return freezeMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    /**
     * Immutable deep copy of a map with string keys.
     *
     * @param map map to copy
     * @return immutable copy
     * @throws IllegalArgumentException if a key is not a string
     */
    public static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new IllegalArgumentException("Map keys must be strings (key: " + entry.getKey() + ")");
            }
            copy.put((String) entry.getKey(), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Number freezeNumber(Number n) {
        if (isIntegral(n) || n instanceof Double || n instanceof Float
            || n instanceof BigDecimal || n instanceof BigInteger) {
            return n;
        }
        // mutable holders: keep the current value only
        if (n instanceof AtomicInteger || n instanceof AtomicLong || n instanceof LongAdder) {
            return n.longValue();
        }
        throw new IllegalArgumentException("Unsupported value type: " + n.getClass().getName());
    }

    private static boolean compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return a.longValue() == b.longValue();
        }
        try {
            return toBigDecimal(a).compareTo(toBigDecimal(b)) == 0;
        } catch (NumberFormatException e) {
            // NaN / Infinity
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return new BigDecimal(n.toString());
    }
}
