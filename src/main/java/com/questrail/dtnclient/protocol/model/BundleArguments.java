package com.questrail.dtnclient.protocol.model;

import com.questrail.dtnclient.eid.EndpointId;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value handling for {@link BundleCreate} arguments.
 *
 * <p>Arguments are stored in the form the wire codec decodes them to:</p>
 * <ul>
 *   <li>{@code Byte/Short/Integer/Long} → {@code Long}; {@code BigInteger}
 *       → {@code Long} when it fits, else kept</li>
 *   <li>{@code Float} → {@code Double}</li>
 *   <li>{@link EndpointId} → its canonical text</li>
 *   <li>{@code byte[]} → a private copy</li>
 *   <li>maps and collections → unmodifiable, insertion-ordered copies</li>
 * </ul>
 *
 * <p>Other values are kept as given; the codec rejects them on encode.
 * Equality compares byte arrays by content at any nesting depth.</p>
 */
final class BundleArguments
{
    private BundleArguments() {}

    static Map<String, Object> normalize(Map<String, Object> args) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            copy.put(entry.getKey(), normalizeValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    static Object normalizeValue(Object value) {
        if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof EndpointId eid) {
            return eid.toString();
        }
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(normalizeValue(entry.getKey()), normalizeValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(normalizeValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    static boolean deepEquals(Object a, Object b) {
        if (a instanceof byte[] x && b instanceof byte[] y) {
            return Arrays.equals(x, y);
        }
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : x.entrySet()) {
                if (!y.containsKey(entry.getKey()) || !deepEquals(entry.getValue(), y.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            Iterator<?> i = x.iterator();
            Iterator<?> j = y.iterator();
            while (i.hasNext()) {
                if (!deepEquals(i.next(), j.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    static int deepHashCode(Object value) {
        if (value instanceof byte[] bytes) {
            return Arrays.hashCode(bytes);
        }
        if (value instanceof Map<?, ?> map) {
            // Order-independent, like Map.hashCode.
            int hash = 0;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                hash += Objects.hashCode(entry.getKey()) ^ deepHashCode(entry.getValue());
            }
            return hash;
        }
        if (value instanceof List<?> list) {
            int hash = 1;
            for (Object element : list) {
                hash = 31 * hash + deepHashCode(element);
            }
            return hash;
        }
        return Objects.hashCode(value);
    }
}
