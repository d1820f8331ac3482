package io.github.flameyossnowy.tally.api.value;

import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.store.CounterStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Everything an initializer may need to compute a counter.
 *
 * @param id The entity's primary key, or null if it has not been persisted yet.
 */
public record InitializerContext<T>(
    @NotNull T entity,
    @Nullable Object id,
    @NotNull FieldModel<T> field,
    @NotNull RepositoryModel<T, ?> model,
    @NotNull CounterStore store
) {
    public boolean isPersisted() {
        return id != null;
    }
}
