package work.lcod.ui.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the opaque JSON values carried by literals, state initials and import data.
 */
public final class JsonValues {
    private JsonValues() {}

    /**
     * Deep copy into unmodifiable maps/lists; scalars are returned as-is.
     */
    public static Object immutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), immutableCopy(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(immutableCopy(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static Map<String, Object> immutableObject(Map<String, ?> value) {
        if (value == null || value.isEmpty()) {
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        var copy = (Map<String, Object>) immutableCopy(value);
        return copy;
    }

    /**
     * Order-preserving unmodifiable copy of a map; null means empty.
     */
    public static <V> Map<String, V> orderedCopy(Map<String, ? extends V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static <T> List<T> listCopy(List<? extends T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return List.copyOf(source);
    }
}
