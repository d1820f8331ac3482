package io.github.flameyossnowy.tally.api.meta;

import org.jetbrains.annotations.Nullable;

/**
 * One side of a link between two entity types.
 * <p>
 * Both sides of the same link share a {@link #linkName()}. The side that declared the link on
 * one of its fields is the owning (forward) side; the other side is synthesized from the
 * declaration's {@code relatedName}.
 */
public interface RelationshipModel<T> {
    /**
     * The relation's name as seen from {@link #declaringEntityType()}.
     */
    String fieldName();

    RelationshipKind relationshipKind();

    boolean isOwning();

    /**
     * Whether more than one member may exist on the other side for one row of this side.
     */
    boolean isCollection();

    Class<T> declaringEntityType();

    Class<?> targetEntityType();

    /**
     * The name of this same link as seen from {@link #targetEntityType()}.
     */
    String relatedName();

    /**
     * Identity of the linking construct; the same for both sides.
     */
    String linkName();

    /**
     * The foreign key field for key-based links. It lives on the declaring type for the owning
     * side and on the target type for the reverse side. Null for many-to-many links.
     */
    @Nullable
    String joinField();

    /**
     * The same link seen from the other side.
     */
    RelationshipModel<?> reverse();
}
