package io.github.drompincen.eligibility.runtime.slots;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Deep merge of slot deltas into the cumulative store. Nested maps merge recursively, lists
 * are unioned without duplicates, and a scalar only replaces the stored value when it is
 * concrete (non-null, not an empty string, not an empty collection). Inputs are never mutated.
 */
public final class SlotMerger {

    private SlotMerger() {}

    public static Map<String, Object> deepMerge(Map<String, ?> base, Map<String, ?> delta) {
        Map<String, Object> result = copyMap(base);
        if (delta == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : delta.entrySet()) {
            String key = entry.getKey();
            Object incoming = entry.getValue();
            Object current = result.get(key);

            if (incoming instanceof Map<?, ?> incomingMap) {
                if (incomingMap.isEmpty() && current != null) {
                    continue;
                }
                Map<String, Object> currentMap = current instanceof Map<?, ?> m ? asStringMap(m) : Map.of();
                if (current != null && !(current instanceof Map<?, ?>)) {
                    result.put(key, deepMerge(Map.of(), asStringMap(incomingMap)));
                } else {
                    result.put(key, deepMerge(currentMap, asStringMap(incomingMap)));
                }
            } else if (incoming instanceof Collection<?> incomingList) {
                if (current instanceof Collection<?> currentList) {
                    result.put(key, union(currentList, incomingList));
                } else if (!incomingList.isEmpty() || current == null) {
                    result.put(key, union(List.of(), incomingList));
                }
            } else if (isConcrete(incoming)) {
                result.put(key, incoming);
            }
        }
        return result;
    }

    /** Merges a per-topic slot delta into the per-topic store. */
    @SuppressWarnings("unchecked")
    public static Map<String, Map<String, Object>> mergeTopics(Map<String, Map<String, Object>> base,
                                                               Map<String, Map<String, Object>> delta) {
        Map<String, Object> merged = deepMerge(base, delta);
        Map<String, Map<String, Object>> typed = new LinkedHashMap<>();
        merged.forEach((topic, fields) -> {
            if (fields instanceof Map<?, ?> m) {
                typed.put(topic, (Map<String, Object>) m);
            }
        });
        return typed;
    }

    public static boolean isConcrete(Object value) {
        if (value == null) return false;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    public static Map<String, Object> copyMap(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, copyValue(v)));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            return copyMap(asStringMap(m));
        }
        if (value instanceof Collection<?> c) {
            List<Object> list = new ArrayList<>(c.size());
            c.forEach(v -> list.add(copyValue(v)));
            return list;
        }
        return value;
    }

    private static List<Object> union(Collection<?> current, Collection<?> incoming) {
        LinkedHashSet<Object> seen = new LinkedHashSet<>();
        current.forEach(v -> seen.add(copyValue(v)));
        incoming.forEach(v -> {
            if (v != null) seen.add(copyValue(v));
        });
        return new ArrayList<>(seen);
    }

    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        Map<String, Object> typed = new LinkedHashMap<>();
        map.forEach((k, v) -> typed.put(String.valueOf(k), v));
        return typed;
    }
}
