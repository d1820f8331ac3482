package io.github.flameyossnowy.tally.memory;

import io.github.flameyossnowy.tally.api.options.SelectQuery;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of one entity type, keyed by primary key. Not thread-safe; guarded by the adapter's lock.
 */
final class MemoryTable {
    private final Map<Object, Map<String, Object>> rows = new LinkedHashMap<>();
    private long sequence;

    long nextId() {
        return ++sequence;
    }

    /**
     * Keeps the sequence ahead of explicitly assigned numeric keys.
     */
    void observeId(@NotNull Object id) {
        if (id instanceof Number number && number.longValue() > sequence) {
            sequence = number.longValue();
        }
    }

    boolean contains(@NotNull Object id) {
        return rows.containsKey(id);
    }

    @Nullable
    Map<String, Object> get(@NotNull Object id) {
        return rows.get(id);
    }

    void put(@NotNull Object id, @NotNull Map<String, Object> row) {
        rows.put(id, row);
    }

    @Nullable
    Map<String, Object> remove(@NotNull Object id) {
        return rows.remove(id);
    }

    /**
     * Live rows matching {@code filter}, keyed by id. Mutating a returned row mutates the table.
     */
    Map<Object, Map<String, Object>> select(@NotNull SelectQuery filter) {
        Map<Object, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map.Entry<Object, Map<String, Object>> entry : rows.entrySet()) {
            if (FilterEvaluator.matchesAll(entry.getValue(), filter.filters())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Ids of the rows whose {@code field} equals {@code value}.
     */
    List<Object> idsWhere(@NotNull String field, @NotNull Object value) {
        List<Object> ids = new ArrayList<>();
        for (Map.Entry<Object, Map<String, Object>> entry : rows.entrySet()) {
            if (FilterEvaluator.equal(entry.getValue().get(field), value)) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    int size() {
        return rows.size();
    }
}
