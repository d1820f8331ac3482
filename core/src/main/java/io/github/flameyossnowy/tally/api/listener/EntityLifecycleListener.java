package io.github.flameyossnowy.tally.api.listener;

/**
 * Hooks fired by a store around entity persistence. All methods default to no-ops.
 *
 * @param <T> The entity type
 */
public interface EntityLifecycleListener<T> {
    /**
     * An entity instance was materialized from a stored row.
     */
    default void onPostLoad(T entity) {
    }

    /**
     * An entity is about to be inserted. It has no persisted key yet unless the caller
     * assigned one.
     */
    default void onPreInsert(T entity) {
    }

    /**
     * An entity was written.
     *
     * @param created true if the row was inserted, false if an existing row was updated
     */
    default void onPostSave(T entity, boolean created) {
    }

    default void onPreDelete(T entity) {
    }

    /**
     * An entity's row was removed. The entity still carries its field values, including the key.
     */
    default void onPostDelete(T entity) {
    }
}
