package io.livekit.sdk.grants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copies for record components. Null elements, keys and values are dropped so a token never carries
 * {@code null} on the wire.
 */
final class Copies {

    private Copies() {
    }

    static <T> List<T> list(List<T> source) {
        if (source == null) {
            return null;
        }
        List<T> copy = new ArrayList<>(source.size());
        for (T element : source) {
            if (element != null) {
                copy.add(element);
            }
        }
        return Collections.unmodifiableList(copy);
    }

    static <K, V> Map<K, V> map(Map<K, V> source) {
        if (source == null) {
            return null;
        }
        Map<K, V> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
