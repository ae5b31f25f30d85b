package workout.logger.api.loader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Fetches the children of many parent keys in one storage call.
 *
 * @param <K> parent key
 * @param <V> child projection
 */
@FunctionalInterface
public interface BatchFunction<K, V> {

    /**
     * @param keys distinct keys, in the order they were first requested
     * @return children per key; keys with no children may be absent
     */
    Map<K, List<V>> load(List<K> keys);

    /**
     * Groups fetched rows by parent key, keeping row order within each group.
     */
    static <K, T, V> Map<K, List<V>> groupBy(List<T> rows, Function<T, K> keyOf, Function<T, V> mapper) {
        Map<K, List<V>> grouped = new LinkedHashMap<>();
        for (T row : rows) {
            grouped.computeIfAbsent(keyOf.apply(row), k -> new ArrayList<>()).add(mapper.apply(row));
        }
        return grouped;
    }
}
