package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.meta.FieldModel;
import io.github.flameyossnowy.tally.api.meta.RelationshipModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import io.github.flameyossnowy.tally.api.value.CounterValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A counter kept equal to the number of members of one relation of its entity.
 * <p>
 * Its initializer counts the relation's members for a persisted row and yields zero for an
 * unsaved one. The relation must be multi-valued from the entity's side; this is checked when
 * the field is created.
 *
 * @param <T> The entity type
 */
public final class RelationCounterField<T> extends CounterField<T> {
    private final String relationName;
    private final RelationshipModel<T> relationship;
    private final RelationClassification classification;

    RelationCounterField(@NotNull RelationCounterRegistry registry, @NotNull RepositoryModel<T, Object> model, @NotNull FieldModel<T> field) {
        super(registry, model, field);

        String relation = field.counterRelation();
        if (relation == null) {
            throw new IllegalArgumentException(model.entitySimpleName() + '.' + field.name() + " is not a relation counter");
        }

        this.relationName = relation;
        this.relationship = registry.store().metadata().relationship(model.getEntityClass(), relation);
        this.classification = RelationClassification.of(relationship);
    }

    public String relationName() {
        return relationName;
    }

    public RelationshipModel<T> relationship() {
        return relationship;
    }

    public RelationClassification classification() {
        return classification;
    }

    /**
     * The tracker keeping this field in sync, created on first request.
     */
    public RelationTracker tracker() {
        return registry.tracker(entityType(), relationName);
    }

    @Override
    protected boolean hasInitializer() {
        return true;
    }

    @Override
    protected @Nullable CounterValue initialValue(@NotNull T entity, @Nullable Object id) {
        if (id == null) {
            return CounterValue.of(0);
        }
        return CounterValue.of(Math.toIntExact(registry.store().countMembers(entityType(), id, relationName)));
    }
}
