package io.livekit.sdk.internal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Conversion between the internal (snake_case) and wire (camelCase) field naming conventions.
 */
public final class KeyCase {

    /**
     * Fields holding caller-defined keys. Their values are copied without renaming.
     */
    static final Set<String> OPAQUE_FIELDS = Set.of("attributes", "metadata");

    private KeyCase() {
    }

    /**
     * {@code room_create} to {@code roomCreate}. Input without underscores is returned unchanged.
     */
    public static String toCamel(String name) {
        if (name == null || name.indexOf('_') < 0) {
            return name;
        }
        StringBuilder out = new StringBuilder(name.length());
        boolean upperNext = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upperNext = out.length() > 0;
                continue;
            }
            out.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return out.toString();
    }

    /**
     * {@code roomCreate} to {@code room_create}. Every upper-case letter starts a new word.
     */
    public static String toSnake(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder out = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && name.charAt(i - 1) != '_') {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Returns a copy of {@code node} with every map key passed through {@code rename}, descending into nested maps
     * and list elements. Scalars are returned as-is.
     */
    public static Object renameKeys(Object node, UnaryOperator<String> rename) {
        if (node instanceof Map) {
            return renameMap((Map<?, ?>) node, rename);
        }
        if (node instanceof Collection) {
            Collection<?> source = (Collection<?>) node;
            List<Object> renamed = new ArrayList<>(source.size());
            for (Object element : source) {
                renamed.add(renameKeys(element, rename));
            }
            return renamed;
        }
        return node;
    }

    /**
     * Typed variant of {@link #renameKeys(Object, UnaryOperator)} for a top-level map.
     */
    public static Map<String, Object> renameMap(Map<?, ?> map, UnaryOperator<String> rename) {
        if (map == null) {
            return null;
        }
        Map<String, Object> renamed = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = OPAQUE_FIELDS.contains(key) ? entry.getValue() : renameKeys(entry.getValue(), rename);
            renamed.put(rename.apply(key), value);
        }
        return renamed;
    }
}
