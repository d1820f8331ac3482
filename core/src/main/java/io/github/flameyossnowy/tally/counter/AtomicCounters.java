package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.options.Query;
import io.github.flameyossnowy.tally.api.options.SelectQuery;
import io.github.flameyossnowy.tally.api.store.CounterStore;
import io.github.flameyossnowy.tally.api.utils.Logging;
import io.github.flameyossnowy.tally.api.value.CounterValue;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Atomic counter writes against a {@link CounterStore}.
 * <p>
 * Nothing here reads a value before writing it; deltas are applied by the store. A delta of
 * zero is dropped, and an update left with nothing to write issues no store call at all.
 */
public final class AtomicCounters {
    private final CounterStore store;
    private final MetadataRegistry metadata;

    public AtomicCounters(@NotNull CounterStore store) {
        this.store = store;
        this.metadata = store.metadata();
    }

    public CounterStore store() {
        return store;
    }

    /**
     * Adds {@code by} to {@code field} on every row matching {@code filter}.
     */
    public void increment(@NotNull Class<?> entityType, @NotNull SelectQuery filter, @NotNull String field, int by) {
        if (by == 0) return;
        store.applyDelta(entityType, filter, field, by);
    }

    /**
     * Subtracts {@code by} from {@code field} on every row matching {@code filter}.
     */
    public void decrement(@NotNull Class<?> entityType, @NotNull SelectQuery filter, @NotNull String field, int by) {
        increment(entityType, filter, field, -by);
    }

    /**
     * Increments several fields of one entity's row in a single update.
     *
     * @param values field name to delta
     * @param reload whether to read the new values back into {@code entity}
     */
    public <T> void incrementMany(@NotNull T entity, @NotNull Map<String, Integer> values, boolean reload) {
        updateValues(entity, values, reload, 1);
    }

    /**
     * Decrements several fields of one entity's row in a single update.
     *
     * @param values field name to delta
     * @param reload whether to read the new values back into {@code entity}
     */
    public <T> void decrementMany(@NotNull T entity, @NotNull Map<String, Integer> values, boolean reload) {
        updateValues(entity, values, reload, -1);
    }

    private <T> void updateValues(T entity, Map<String, Integer> values, boolean reload, int multiplier) {
        Map<String, Integer> deltas = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : values.entrySet()) {
            int delta = entry.getValue();
            if (delta != 0) {
                deltas.put(entry.getKey(), delta * multiplier);
            }
        }

        if (deltas.isEmpty()) return;

        RepositoryModel<T, Object> model = modelOf(entity);
        Object id = requireId(model, entity);

        Logging.deepInfo(() -> "Applying " + deltas + " to " + model.entitySimpleName() + '[' + id + ']');
        store.applyDeltas(model.getEntityClass(), byId(model, id), deltas);

        if (reload) {
            reloadFields(entity, deltas.keySet());
        }
    }

    /**
     * Assigns several fields of one entity's row in a single update.
     */
    public <T> void setValues(@NotNull T entity, @NotNull Map<String, CounterValue> values, boolean reload) {
        if (values.isEmpty()) return;

        RepositoryModel<T, Object> model = modelOf(entity);
        Object id = requireId(model, entity);

        store.assign(model.getEntityClass(), byId(model, id), values);

        if (reload) {
            reloadFields(entity, values.keySet());
        }
    }

    /**
     * Reads the stored values of {@code fields} back into {@code entity}.
     */
    public <T> void reloadFields(@NotNull T entity, @NotNull Collection<String> fields) {
        if (fields.isEmpty()) return;

        RepositoryModel<T, Object> model = modelOf(entity);
        Object id = requireId(model, entity);

        Map<String, Object> values = store.readFields(model.getEntityClass(), id, fields);
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            FieldModel<T> field = model.fieldByName(entry.getKey());
            if (field != null) {
                field.setValue(entity, entry.getValue());
            }
        }
    }

    /**
     * Adds {@code by} to every field in {@code fields} on the rows with the given ids, without
     * loading them.
     */
    public void updateCounts(@NotNull Class<?> entityType, @NotNull Collection<?> ids, @NotNull Collection<String> fields, int by) {
        if (by == 0 || ids.isEmpty() || fields.isEmpty()) return;

        Map<String, Integer> deltas = new LinkedHashMap<>();
        for (String field : fields) {
            deltas.put(field, by);
        }

        RepositoryModel<?, ?> model = metadata.require(entityType);
        store.applyDeltas(entityType, Query.byIds(model.getPrimaryKey().name(), ids), deltas);
    }

    /**
     * Sets every field in {@code fields} to zero on one row, without loading it.
     */
    public void zeroCounts(@NotNull Class<?> entityType, @NotNull Object id, @NotNull Collection<String> fields) {
        if (fields.isEmpty()) return;

        Map<String, CounterValue> values = new LinkedHashMap<>();
        for (String field : fields) {
            values.put(field, CounterValue.of(0));
        }

        RepositoryModel<?, ?> model = metadata.require(entityType);
        store.assign(entityType, Query.byId(model.getPrimaryKey().name(), id), values);
    }

    @SuppressWarnings("unchecked")
    private <T> RepositoryModel<T, Object> modelOf(T entity) {
        return (RepositoryModel<T, Object>) (RepositoryModel<?, ?>) metadata.require(entity.getClass());
    }

    private static <T> Object requireId(RepositoryModel<T, Object> model, T entity) {
        Object id = model.getPrimaryKeyValue(entity);
        if (id == null) {
            throw new IllegalStateException("Cannot update counters of an unsaved " + model.entitySimpleName());
        }
        return id;
    }

    private static SelectQuery byId(RepositoryModel<?, ?> model, Object id) {
        return Query.byId(model.getPrimaryKey().name(), id);
    }
}
