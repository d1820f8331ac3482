package io.github.flameyossnowy.tally.api.meta;

import io.github.flameyossnowy.tally.api.annotations.ManyToMany;
import io.github.flameyossnowy.tally.api.annotations.ManyToOne;
import io.github.flameyossnowy.tally.api.annotations.OneToOne;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link RepositoryModel} built by scanning an entity class and its superclasses.
 */
@SuppressWarnings("unchecked")
final class ReflectiveRepositoryModel<T, ID> implements RepositoryModel<T, ID> {
    private final Class<T> entityClass;
    private final Map<String, FieldModel<T>> fieldsByName = new LinkedHashMap<>();
    private final List<FieldModel<T>> fields;
    private final List<RelationshipModel<T>> relationships;
    private final FieldModel<T> primaryKey;
    private final Constructor<T> constructor;

    ReflectiveRepositoryModel(@NotNull Class<T> entityClass) {
        this.entityClass = entityClass;

        List<RelationshipModel<T>> relationships = new ArrayList<>();
        FieldModel<T> primaryKey = null;

        for (Class<?> type = entityClass; type != null && type != Object.class; type = type.getSuperclass()) {
            for (Field field : type.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) continue;

                ReflectiveFieldModel<T> model = new ReflectiveFieldModel<>(field);
                if (fieldsByName.putIfAbsent(model.name(), model) != null) continue;

                if (model.id()) {
                    if (primaryKey != null) {
                        throw new IllegalStateException("Entity " + entityClass.getSimpleName() + " declares more than one @Id");
                    }
                    primaryKey = model;
                }

                if (model.relationship()) {
                    relationships.add(relationshipOf(field, model.relationshipKind()));
                }
            }
        }

        if (primaryKey == null) {
            throw new IllegalStateException("Entity " + entityClass.getSimpleName() + " has no @Id field");
        }

        this.primaryKey = primaryKey;
        this.fields = List.copyOf(fieldsByName.values());
        this.relationships = Collections.unmodifiableList(relationships);

        try {
            this.constructor = entityClass.getDeclaredConstructor();
            this.constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Entity " + entityClass.getSimpleName() + " needs a no-arg constructor", e);
        }
    }

    private RelationshipModel<T> relationshipOf(Field field, RelationshipKind kind) {
        return switch (kind) {
            case MANY_TO_MANY -> {
                ManyToMany annotation = field.getAnnotation(ManyToMany.class);
                yield DeclaredRelationship.forward(entityClass, field.getName(), kind, annotation.target(), annotation.relatedName());
            }
            case MANY_TO_ONE -> {
                ManyToOne annotation = field.getAnnotation(ManyToOne.class);
                yield DeclaredRelationship.forward(entityClass, field.getName(), kind, annotation.target(), annotation.relatedName());
            }
            case ONE_TO_ONE -> {
                OneToOne annotation = field.getAnnotation(OneToOne.class);
                yield DeclaredRelationship.forward(entityClass, field.getName(), kind, annotation.target(), annotation.relatedName());
            }
            case ONE_TO_MANY -> throw new IllegalStateException("One-to-many sides are never declared on a field: " + field.getName());
        };
    }

    @Override
    public String entitySimpleName() {
        return entityClass.getSimpleName();
    }

    @Override
    public List<FieldModel<T>> fields() {
        return fields;
    }

    @Override
    public FieldModel<T> fieldByName(String name) {
        return fieldsByName.get(name);
    }

    @Override
    public FieldModel<T> getPrimaryKey() {
        return primaryKey;
    }

    @Override
    public ID getPrimaryKeyValue(T entity) {
        return (ID) primaryKey.getValue(entity);
    }

    @Override
    public void setPrimaryKeyValue(T entity, ID id) {
        primaryKey.setValue(entity, id);
    }

    @Override
    public List<RelationshipModel<T>> getRelationships() {
        return relationships;
    }

    @Override
    public Class<T> getEntityClass() {
        return entityClass;
    }

    @Override
    public Class<ID> getIdClass() {
        return (Class<ID>) primaryKey.type();
    }

    @Override
    public T newInstance() {
        try {
            return constructor.newInstance();
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot instantiate " + entityClass.getName(), e);
        }
    }

    @Override
    public String toString() {
        return "RepositoryModel[" + entityClass.getSimpleName() + ']';
    }
}
