package io.github.flameyossnowy.tally.api.meta;

import io.github.flameyossnowy.tally.api.exceptions.RelationConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of entity metadata.
 * <p>
 * Entities must be registered before they are stored or loaded. Besides looking up
 * {@link RepositoryModel}s, this resolves relation names from either side of a link: a name
 * is first looked up among the entity's own relationship fields, then among the
 * {@code relatedName}s other registered entities gave to links pointing at it.
 */
public final class MetadataRegistry {
    private final Map<Class<?>, RepositoryModel<?, ?>> byEntityClass = new ConcurrentHashMap<>();

    /**
     * Registers entity classes. Registering a class twice is a no-op.
     *
     * @throws IllegalStateException if a class is not a valid entity
     */
    public MetadataRegistry register(@NotNull Class<?>... entityClasses) {
        for (Class<?> entityClass : entityClasses) {
            byEntityClass.computeIfAbsent(entityClass, ReflectiveRepositoryModel::new);
        }
        return this;
    }

    /**
     * Registers a hand-built model, replacing any model already registered for its class.
     */
    public MetadataRegistry register(@NotNull RepositoryModel<?, ?> model) {
        byEntityClass.put(model.getEntityClass(), model);
        return this;
    }

    @Nullable
    @SuppressWarnings("unchecked")
    public <T, ID> RepositoryModel<T, ID> getByEntityClass(@NotNull Class<T> entityClass) {
        return (RepositoryModel<T, ID>) byEntityClass.get(entityClass);
    }

    /**
     * Gets a repository model by entity class.
     *
     * @throws IllegalStateException if the class was never registered
     */
    @NotNull
    public <T, ID> RepositoryModel<T, ID> require(@NotNull Class<T> entityClass) {
        RepositoryModel<T, ID> model = getByEntityClass(entityClass);
        if (model == null) {
            throw new IllegalStateException("Unknown entity type " + entityClass.getName() + "; register it first");
        }
        return model;
    }

    public Collection<RepositoryModel<?, ?>> getAll() {
        return Collections.unmodifiableCollection(byEntityClass.values());
    }

    /**
     * Resolves a relation by its name as seen from {@code ownerType}.
     *
     * @throws RelationConfigurationException if no such relation exists
     */
    @NotNull
    @SuppressWarnings("unchecked")
    public <T> RelationshipModel<T> relationship(@NotNull Class<T> ownerType, @NotNull String relationName) {
        RepositoryModel<T, ?> owner = getByEntityClass(ownerType);
        if (owner == null) {
            throw new RelationConfigurationException(
                "Unknown entity type " + ownerType.getName() + "; register it first", ownerType, relationName);
        }

        for (RelationshipModel<T> relationship : owner.getRelationships()) {
            if (relationship.fieldName().equals(relationName)) {
                return relationship;
            }
        }

        for (RepositoryModel<?, ?> other : byEntityClass.values()) {
            for (RelationshipModel<?> relationship : other.getRelationships()) {
                if (relationship.targetEntityType() == ownerType && relationship.relatedName().equals(relationName)) {
                    return (RelationshipModel<T>) relationship.reverse();
                }
            }
        }

        throw new RelationConfigurationException(
            "No relation named '" + relationName + "' on " + ownerType.getSimpleName(), ownerType, relationName);
    }

    /**
     * Removes every registered model. Intended for tests.
     */
    public void clear() {
        byEntityClass.clear();
    }
}
