package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.options.SelectQuery;
import io.github.flameyossnowy.tally.api.utils.Logging;
import io.github.flameyossnowy.tally.api.value.CounterInitializer;
import io.github.flameyossnowy.tally.api.value.CounterValue;
import io.github.flameyossnowy.tally.api.value.InitializerContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Operations on one counter field of an entity type.
 * <p>
 * Increments and decrements are applied by the store as atomic deltas and never read the value
 * first. The in-memory value is only refreshed when a reload is requested.
 *
 * @param <T> The entity type
 */
public class CounterField<T> {
    protected final RelationCounterRegistry registry;
    protected final RepositoryModel<T, Object> model;
    protected final FieldModel<T> field;

    CounterField(@NotNull RelationCounterRegistry registry, @NotNull RepositoryModel<T, Object> model, @NotNull FieldModel<T> field) {
        if (!field.isCounter()) {
            throw new IllegalArgumentException(model.entitySimpleName() + '.' + field.name() + " is not a counter");
        }
        this.registry = registry;
        this.model = model;
        this.field = field;
    }

    public String name() {
        return field.name();
    }

    public FieldModel<T> fieldModel() {
        return field;
    }

    public Class<T> entityType() {
        return model.getEntityClass();
    }

    /**
     * Reads the counter, initializing it first if it has no value yet.
     */
    public @Nullable Integer value(@NotNull T entity) {
        registry.attach(entity);
        return (Integer) field.getValue(entity);
    }

    public void increment(@NotNull T entity) {
        increment(entity, 1);
    }

    public void increment(@NotNull T entity, int by) {
        increment(entity, by, registry.config().reloadAfterWrite());
    }

    /**
     * Adds {@code by} to this counter on the entity's row.
     *
     * @param reload whether to read the new value back into {@code entity}
     * @throws IllegalStateException if the entity was never persisted
     */
    public void increment(@NotNull T entity, int by, boolean reload) {
        registry.counters().incrementMany(entity, Map.of(name(), by), reload);
    }

    public void decrement(@NotNull T entity) {
        decrement(entity, 1);
    }

    public void decrement(@NotNull T entity, int by) {
        decrement(entity, by, registry.config().reloadAfterWrite());
    }

    /**
     * Subtracts {@code by} from this counter on the entity's row.
     *
     * @param reload whether to read the new value back into {@code entity}
     * @throws IllegalStateException if the entity was never persisted
     */
    public void decrement(@NotNull T entity, int by, boolean reload) {
        registry.counters().decrementMany(entity, Map.of(name(), by), reload);
    }

    /**
     * Adds {@code by} to this counter on every row matching {@code filter}. Loaded instances are
     * not refreshed.
     */
    public void increment(@NotNull SelectQuery filter, int by) {
        registry.counters().increment(entityType(), filter, name(), by);
    }

    /**
     * Subtracts {@code by} from this counter on every row matching {@code filter}. Loaded
     * instances are not refreshed.
     */
    public void decrement(@NotNull SelectQuery filter, int by) {
        registry.counters().decrement(entityType(), filter, name(), by);
    }

    /**
     * Re-reads only this counter from the store.
     */
    public void reload(@NotNull T entity) {
        registry.counters().reloadFields(entity, List.of(name()));
    }

    /**
     * Recomputes the counter from its initializer and stores the result.
     * <p>
     * An unsaved entity without an initializer is left alone. A call made while the same
     * entity and field is already being initialized returns without doing anything; the outer
     * call supplies the value.
     */
    public void reinit(@NotNull T entity) {
        Object id = model.getPrimaryKeyValue(entity);
        if (id == null && !hasInitializer()) {
            return;
        }

        CounterValue value;
        if (!hasInitializer()) {
            value = CounterValue.of(0);
        } else {
            ReentryGuard.Token token = registry.reentryGuard().tryAcquire(entity, name());
            if (token == null) {
                Logging.deepInfo(() -> "Skipping nested reinit of " + model.entitySimpleName() + '.' + name());
                return;
            }

            try (token) {
                value = initialValue(entity, id);
            }
        }

        if (value == null) {
            return;
        }

        if (value instanceof CounterValue.Deferred && id == null) {
            value = CounterValue.of(0);
        }

        if (value instanceof CounterValue.Deferred deferred) {
            registry.counters().setValues(entity, Map.<String, CounterValue>of(name(), deferred), true);
        } else if (value instanceof CounterValue.Concrete concrete) {
            field.setValue(entity, concrete.value());
            if (id != null) {
                registry.counters().setValues(entity, Map.<String, CounterValue>of(name(), concrete), false);
            }
        }
    }

    protected boolean hasInitializer() {
        return field.counterInitializer() != null;
    }

    /**
     * Runs this field's initializer.
     */
    protected @Nullable CounterValue initialValue(@NotNull T entity, @Nullable Object id) {
        CounterInitializer<T> initializer = field.counterInitializer();
        if (initializer == null) {
            return null;
        }
        return initializer.initialize(new InitializerContext<>(entity, id, field, model, registry.store()));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '[' + model.entitySimpleName() + '.' + name() + ']';
    }
}
