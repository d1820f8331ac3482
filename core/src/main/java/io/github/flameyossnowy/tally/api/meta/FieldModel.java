package io.github.flameyossnowy.tally.api.meta;

import io.github.flameyossnowy.tally.api.value.CounterInitializer;
import org.jetbrains.annotations.Nullable;

/**
 * Represents metadata about a field in an entity.
 * Generic type T represents the entity type this field belongs to.
 */
public interface FieldModel<T> {
    String name();

    Class<?> type();

    boolean id();

    boolean autoIncrement();

    boolean relationship();

    @Nullable
    RelationshipKind relationshipKind();

    CounterKind counterKind();

    /**
     * Name of the relation counted by this field, or null if this is not a relation counter.
     */
    @Nullable
    String counterRelation();

    /**
     * The initializer declared for this counter, or null if none was declared.
     * Relation counters always report null here; their initializer is implied by the relation.
     */
    @Nullable
    CounterInitializer<T> counterInitializer();

    /**
     * Default value for this field, or null if none specified
     */
    @Nullable
    String defaultValue();

    default boolean isCounter() {
        return counterKind() != CounterKind.NONE;
    }

    default boolean isRelationCounter() {
        return counterKind() == CounterKind.RELATION_COUNTER;
    }

    /**
     * Get the value of this field from the given entity.
     *
     * @param entity The entity to extract the value from
     * @return The field value
     * @throws IllegalStateException if reflection fails
     */
    Object getValue(T entity);

    /**
     * Set the value of this field on the given entity.
     *
     * @param entity The entity to set the value on
     * @param value The value to set
     * @throws IllegalStateException if reflection fails
     */
    void setValue(T entity, Object value);
}
