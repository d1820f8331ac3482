package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Every {@link InstanceState} currently tracked, split into unsaved states (keyed by instance
 * identity) and saved states (keyed by {@link StateKey}, one per loaded representation).
 * <p>
 * States whose instance was collected are swept lazily: whenever a state is stored and whenever
 * {@link #hasTrackedStates()} is asked. There is no background cleanup.
 * <p>
 * All access goes through one reentrant lock, since a sweep can be reached again from inside a
 * store operation. No store I/O happens while it is held.
 */
public final class StateRegistry {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<IdentityKey, InstanceState> unsavedStates = new HashMap<>();
    private final Map<StateKey, List<InstanceState>> savedStates = new HashMap<>();
    private final AtomicCounters counters;

    public StateRegistry(@NotNull AtomicCounters counters) {
        this.counters = counters;
    }

    ReentrantLock lock() {
        return lock;
    }

    AtomicCounters counters() {
        return counters;
    }

    /**
     * Looks up or creates the state for {@code entity} and the relation of {@code field}, and
     * starts tracking {@code field} on it.
     */
    @SuppressWarnings("unchecked")
    public <T> InstanceState storeState(@NotNull T entity, @NotNull RepositoryModel<T, ?> model, @NotNull FieldModel<T> field) {
        String relationName = field.counterRelation();
        if (relationName == null) {
            throw new IllegalArgumentException("Field " + field.name() + " is not a relation counter");
        }

        RepositoryModel<Object, Object> erasedModel = (RepositoryModel<Object, Object>) (RepositoryModel<?, ?>) model;

        lock.lock();
        try {
            sweep();

            Object id = model.getPrimaryKeyValue(entity);
            InstanceState state;

            if (id == null) {
                state = unsavedStates.computeIfAbsent(
                    new IdentityKey(entity),
                    ignored -> new InstanceState(this, entity, erasedModel, null));
            } else {
                StateKey key = new StateKey(model.getEntityClass(), id, relationName);
                List<InstanceState> states = savedStates.computeIfAbsent(key, ignored -> new ArrayList<>(2));
                state = find(states, entity);

                if (state == null) {
                    state = new InstanceState(this, entity, erasedModel, key);
                    states.add(state);
                    Logging.deepInfo(() -> "Tracking " + key + " (" + states.size() + " loaded)");
                }
            }

            state.trackField((FieldModel<Object>) (FieldModel<?>) field);
            return state;
        } finally {
            lock.unlock();
        }
    }

    private static @Nullable InstanceState find(List<InstanceState> states, Object entity) {
        for (InstanceState state : states) {
            if (state.entity() == entity) {
                return state;
            }
        }
        return null;
    }

    /**
     * Every live state loaded for one row and relation, or an empty list.
     */
    public List<InstanceState> getSavedStates(@NotNull Class<?> entityType, @NotNull Object id, @NotNull String relationName) {
        lock.lock();
        try {
            List<InstanceState> states = savedStates.get(new StateKey(entityType, id, relationName));
            if (states == null) {
                return Collections.emptyList();
            }

            List<InstanceState> live = new ArrayList<>(states.size());
            for (InstanceState state : states) {
                if (state.isAlive()) {
                    live.add(state);
                }
            }
            return live;
        } finally {
            lock.unlock();
        }
    }

    public @Nullable InstanceState getUnsavedState(@NotNull Object entity) {
        lock.lock();
        try {
            return unsavedStates.get(new IdentityKey(entity));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every state belonging to {@code entity}, every saved state of the row
     * {@code (entityType, id)}, and every dead state.
     *
     * @param id the row's key, or null to only drop states of {@code entity} itself
     */
    public void resetState(@NotNull Class<?> entityType, @Nullable Object id, @NotNull Object entity) {
        lock.lock();
        try {
            unsavedStates.entrySet().removeIf(entry -> {
                Object tracked = entry.getValue().entity();
                return tracked == null || tracked == entity;
            });

            Iterator<Map.Entry<StateKey, List<InstanceState>>> iterator = savedStates.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<StateKey, List<InstanceState>> entry = iterator.next();
                StateKey key = entry.getKey();
                boolean sameRow = id != null && key.entityType() == entityType && key.id().equals(id);

                if (sameRow) {
                    iterator.remove();
                    continue;
                }

                entry.getValue().removeIf(state -> {
                    Object tracked = state.entity();
                    return tracked == null || tracked == entity;
                });

                if (entry.getValue().isEmpty()) {
                    iterator.remove();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every state whose instance was collected.
     */
    public void sweep() {
        lock.lock();
        try {
            unsavedStates.entrySet().removeIf(entry -> !entry.getKey().isAlive() || !entry.getValue().isAlive());

            Iterator<List<InstanceState>> iterator = savedStates.values().iterator();
            while (iterator.hasNext()) {
                List<InstanceState> states = iterator.next();
                states.removeIf(state -> !state.isAlive());
                if (states.isEmpty()) {
                    iterator.remove();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether any live state remains. Sweeps first.
     */
    public boolean hasTrackedStates() {
        lock.lock();
        try {
            sweep();
            return !unsavedStates.isEmpty() || !savedStates.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            unsavedStates.clear();
            savedStates.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies {@code main}'s tracked counters into every other live representation of its row.
     */
    void copyToSiblings(@NotNull InstanceState main, @NotNull Object mainEntity) {
        for (InstanceState sibling : siblingsOf(main)) {
            sibling.copyFieldsFrom(mainEntity);
        }
    }

    /**
     * Re-reads the tracked counters of every other live representation of {@code main}'s row.
     */
    void reloadSiblings(@NotNull InstanceState main) {
        for (InstanceState sibling : siblingsOf(main)) {
            sibling.reloadFields();
        }
    }

    private List<InstanceState> siblingsOf(InstanceState main) {
        StateKey key = main.key();
        if (key == null) {
            return Collections.emptyList();
        }

        List<InstanceState> siblings = new ArrayList<>(getSavedStates(key.entityType(), key.id(), key.relationName()));
        siblings.remove(main);
        return siblings;
    }
}
