package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.value.CounterValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bookkeeping for one loaded entity instance.
 * <p>
 * A saved state belongs to one (instance, relation name) pair and tracks every relation counter
 * of that instance following that relation. An unsaved state belongs to an instance that has no
 * persisted key yet and tracks all of its relation counters; it is replaced by saved states the
 * first time the instance is persisted.
 * <p>
 * The instance is only weakly referenced. Once it is collected the state is dead and is swept
 * from the {@link StateRegistry} on its next store operation.
 */
public final class InstanceState {
    private final StateRegistry registry;
    private final WeakReference<Object> entityRef;
    private final RepositoryModel<Object, Object> model;
    private final @Nullable StateKey key;
    private final Set<FieldModel<Object>> fields = new LinkedHashSet<>();
    private final Set<Object> pendingClear = new HashSet<>();

    InstanceState(
        @NotNull StateRegistry registry,
        @NotNull Object entity,
        @NotNull RepositoryModel<Object, Object> model,
        @Nullable StateKey key
    ) {
        this.registry = registry;
        this.entityRef = new WeakReference<>(entity);
        this.model = model;
        this.key = key;
    }

    public @Nullable Object entity() {
        return entityRef.get();
    }

    public boolean isAlive() {
        return entityRef.get() != null;
    }

    public boolean isSaved() {
        return key != null;
    }

    /**
     * The (type, id, relation) this state is registered under, or null for an unsaved state.
     */
    public @Nullable StateKey key() {
        return key;
    }

    public Class<?> entityType() {
        return model.getEntityClass();
    }

    /**
     * Adds a counter field to this state. Adding a field twice is a no-op.
     */
    void trackField(@NotNull FieldModel<Object> field) {
        registry.lock().lock();
        try {
            fields.add(field);
        } finally {
            registry.lock().unlock();
        }
    }

    public List<String> fieldNames() {
        registry.lock().lock();
        try {
            List<String> names = new ArrayList<>(fields.size());
            for (FieldModel<Object> field : fields) {
                names.add(field.name());
            }
            return names;
        } finally {
            registry.lock().unlock();
        }
    }

    /**
     * Atomically increments every tracked counter of this state's row, then brings every other
     * loaded representation of the row up to date.
     */
    public void incrementFields(int by) {
        applyDelta(by);
    }

    /**
     * Atomically decrements every tracked counter of this state's row, then brings every other
     * loaded representation of the row up to date.
     */
    public void decrementFields(int by) {
        applyDelta(-by);
    }

    private void applyDelta(int delta) {
        if (delta == 0) return;

        List<String> names = fieldNames();
        Object entity = entity();

        if (entity == null) {
            // Nobody to read the result into: write by key and let every sibling re-read it.
            registry.counters().updateCounts(model.getEntityClass(), List.of(requireKey().id()), names, delta);
            registry.reloadSiblings(this);
            return;
        }

        Map<String, Integer> deltas = new LinkedHashMap<>();
        for (String name : names) {
            deltas.put(name, delta);
        }

        registry.counters().incrementMany(entity, deltas, true);
        registry.copyToSiblings(this, entity);
    }

    /**
     * Sets every tracked counter of this state's row to zero, then brings every other loaded
     * representation of the row up to date.
     */
    public void zeroFields() {
        List<String> names = fieldNames();
        Object entity = entity();

        if (entity == null) {
            registry.counters().zeroCounts(model.getEntityClass(), requireKey().id(), names);
            registry.reloadSiblings(this);
            return;
        }

        Map<String, CounterValue> values = new LinkedHashMap<>();
        for (String name : names) {
            values.put(name, CounterValue.of(0));
        }

        registry.counters().setValues(entity, values, true);
        registry.copyToSiblings(this, entity);
    }

    /**
     * Re-reads every tracked counter from the store.
     */
    public void reloadFields() {
        Object entity = entity();
        if (entity != null) {
            registry.counters().reloadFields(entity, fieldNames());
        }
    }

    /**
     * Copies the tracked counter values from another representation of the same row.
     */
    void copyFieldsFrom(@NotNull Object source) {
        Object entity = entity();
        if (entity == null) return;

        for (String name : fieldNames()) {
            FieldModel<Object> field = model.fieldByName(name);
            field.setValue(entity, field.getValue(source));
        }
    }

    /**
     * Remembers members about to be removed by a clear, which reports no ids itself.
     */
    public void cachePendingClear(@NotNull Collection<?> ids) {
        registry.lock().lock();
        try {
            pendingClear.addAll(ids);
        } finally {
            registry.lock().unlock();
        }
    }

    /**
     * Returns and forgets the members remembered by {@link #cachePendingClear(Collection)}.
     */
    public Set<Object> consumePendingClear() {
        registry.lock().lock();
        try {
            Set<Object> ids = new HashSet<>(pendingClear);
            pendingClear.clear();
            return ids;
        } finally {
            registry.lock().unlock();
        }
    }

    private StateKey requireKey() {
        if (key == null) {
            throw new IllegalStateException("Unsaved state has no stored row: " + this);
        }
        return key;
    }

    @Override
    public String toString() {
        Object entity = entity();
        if (entity == null) {
            return "InstanceState[" + model.entitySimpleName() + " (destroyed)]";
        }
        return "InstanceState[" + model.entitySimpleName() + ", id=" + model.getPrimaryKeyValue(entity) + ", fields=" + fieldNames() + ']';
    }
}
