package io.github.flameyossnowy.tally.api.store;

import io.github.flameyossnowy.tally.api.exceptions.StoreException;
import io.github.flameyossnowy.tally.api.listener.ListenerRegistry;
import io.github.flameyossnowy.tally.api.meta.MetadataRegistry;
import io.github.flameyossnowy.tally.api.options.SelectQuery;
import io.github.flameyossnowy.tally.api.value.CounterValue;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * The operations counter synchronization needs from the store of truth.
 * <p>
 * Every write must be atomic per matched row and must not read the value back first:
 * correctness across threads and processes relies entirely on the store applying
 * {@code field := field + delta} itself. All methods report failures as {@link StoreException}.
 */
public interface CounterStore {
    /**
     * Applies {@code field := field + delta} for every entry of {@code deltas} on each row
     * matching {@code filter}, in one atomic update. A {@code null} stored value stays
     * {@code null}.
     *
     * @return the number of rows matched
     */
    int applyDeltas(@NotNull Class<?> entityType, @NotNull SelectQuery filter, @NotNull Map<String, Integer> deltas);

    /**
     * Applies one delta to one field.
     *
     * @return the number of rows matched
     */
    default int applyDelta(@NotNull Class<?> entityType, @NotNull SelectQuery filter, @NotNull String field, int delta) {
        return applyDeltas(entityType, filter, Map.of(field, delta));
    }

    /**
     * Assigns values to fields on each row matching {@code filter}. Deferred values are evaluated
     * by the store, per row, at write time.
     *
     * @return the number of rows matched
     * @throws StoreException if a deferred expression is not supported
     */
    int assign(@NotNull Class<?> entityType, @NotNull SelectQuery filter, @NotNull Map<String, CounterValue> values);

    /**
     * Reads the current stored values of some fields of one row.
     *
     * @throws StoreException if the row does not exist
     */
    @NotNull
    Map<String, Object> readFields(@NotNull Class<?> entityType, @NotNull Object id, @NotNull Collection<String> fields);

    /**
     * The ids of the members currently linked to a row through a relation.
     */
    @NotNull
    Set<Object> memberIds(@NotNull Class<?> ownerType, @NotNull Object ownerId, @NotNull String relationName);

    default long countMembers(@NotNull Class<?> ownerType, @NotNull Object ownerId, @NotNull String relationName) {
        return memberIds(ownerType, ownerId, relationName).size();
    }

    @NotNull
    MetadataRegistry metadata();

    /**
     * Where this store publishes lifecycle and relation-change notifications.
     */
    @NotNull
    ListenerRegistry listeners();
}
