package io.github.flameyossnowy.tally.api.meta;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents metadata about a repository/entity.
 * Generic types:
 * - T: The entity type
 * - ID: The primary key type
 */
public interface RepositoryModel<T, ID> {
    String entitySimpleName();

    List<FieldModel<T>> fields();

    FieldModel<T> fieldByName(String name);

    FieldModel<T> getPrimaryKey();

    ID getPrimaryKeyValue(T entity);

    void setPrimaryKeyValue(T entity, ID id);

    /**
     * Relationships declared on this entity's own fields. Reverse sides are resolved through
     * {@link MetadataRegistry#relationship(Class, String)}.
     */
    List<RelationshipModel<T>> getRelationships();

    Class<T> getEntityClass();

    Class<ID> getIdClass();

    T newInstance();

    default List<FieldModel<T>> counterFields() {
        List<FieldModel<T>> list = new ArrayList<>();
        for (FieldModel<T> field : fields()) {
            if (field.isCounter()) {
                list.add(field);
            }
        }
        return list;
    }

    default List<FieldModel<T>> relationCounterFields() {
        List<FieldModel<T>> list = new ArrayList<>();
        for (FieldModel<T> field : fields()) {
            if (field.isRelationCounter()) {
                list.add(field);
            }
        }
        return list;
    }

    default boolean hasCounters() {
        return !counterFields().isEmpty();
    }
}
