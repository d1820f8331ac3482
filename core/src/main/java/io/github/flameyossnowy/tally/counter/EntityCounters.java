package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The counter fields of one entity type.
 *
 * @param <T> The entity type
 */
public final class EntityCounters<T> {
    private final RelationCounterRegistry registry;
    private final RepositoryModel<T, Object> model;
    private final Map<String, CounterField<T>> fields = new LinkedHashMap<>();
    private final List<RelationCounterField<T>> relationFields = new ArrayList<>();

    EntityCounters(@NotNull RelationCounterRegistry registry, @NotNull RepositoryModel<T, Object> model) {
        this.registry = registry;
        this.model = model;

        for (FieldModel<T> field : model.counterFields()) {
            if (field.isRelationCounter()) {
                RelationCounterField<T> relationField = new RelationCounterField<>(registry, model, field);
                fields.put(field.name(), relationField);
                relationFields.add(relationField);
            } else {
                fields.put(field.name(), new CounterField<>(registry, model, field));
            }
        }
    }

    public RepositoryModel<T, Object> model() {
        return model;
    }

    /**
     * @throws IllegalArgumentException if the entity has no counter with that name
     */
    public CounterField<T> field(@NotNull String name) {
        CounterField<T> field = fields.get(name);
        if (field == null) {
            throw new IllegalArgumentException(model.entitySimpleName() + " has no counter named '" + name + '\'');
        }
        return field;
    }

    /**
     * @throws IllegalArgumentException if the entity has no relation counter with that name
     */
    public RelationCounterField<T> relationField(@NotNull String name) {
        CounterField<T> field = field(name);
        if (!(field instanceof RelationCounterField<T> relationField)) {
            throw new IllegalArgumentException(model.entitySimpleName() + '.' + name + " is not a relation counter");
        }
        return relationField;
    }

    public Collection<CounterField<T>> fields() {
        return Collections.unmodifiableCollection(fields.values());
    }

    public List<RelationCounterField<T>> relationFields() {
        return Collections.unmodifiableList(relationFields);
    }

    /**
     * Names of the relation counters following {@code relationName}, in declaration order.
     */
    public List<String> relationFieldNames(@NotNull String relationName) {
        List<String> names = new ArrayList<>(2);
        for (RelationCounterField<T> field : relationFields) {
            if (field.relationName().equals(relationName)) {
                names.add(field.name());
            }
        }
        return names;
    }

    /**
     * Registers the entity's relation counters with the state registry and initializes every
     * counter that has no value yet.
     */
    void attach(@NotNull T entity) {
        StateRegistry states = registry.stateRegistry();
        ReentryGuard guard = registry.reentryGuard();

        for (RelationCounterField<T> field : relationFields) {
            states.storeState(entity, model, field.fieldModel());
            field.tracker();
        }

        for (CounterField<T> field : fields.values()) {
            if (field.fieldModel().getValue(entity) == null && !guard.isHeld(entity, field.name())) {
                field.reinit(entity);
            }
        }
    }
}
