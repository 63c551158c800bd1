package eventsource.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers for structured payloads (nested maps, lists and scalars).
 */
public final class Payloads {

    private Payloads() {
    }

    /**
     * Returns a deep, unmodifiable copy of the given payload. {@code null} yields an empty map.
     *
     * @throws IllegalArgumentException if a map key is null
     */
    public static Map<String, Object> immutableCopy(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("payload cannot contain null keys");
            }
            copy.put(entry.getKey(), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a deep, mutable copy of the given payload, suitable for handing to code
     * that builds a new payload from an old one.
     */
    public static Map<String, Object> mutableCopy(Map<String, ?> payload) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (payload == null) {
            return copy;
        }
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            copy.put(entry.getKey(), thaw(entry.getValue()));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableCopy((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(freeze(element));
            }
            return Collections.unmodifiableList(list);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Object thaw(Object value) {
        if (value instanceof Map<?, ?> map) {
            return mutableCopy((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            for (Object element : collection) {
                list.add(thaw(element));
            }
            return list;
        }
        return value;
    }
}
