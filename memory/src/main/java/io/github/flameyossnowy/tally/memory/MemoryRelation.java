package io.github.flameyossnowy.tally.memory;

import io.github.flameyossnowy.tally.api.listener.RelationAction;
import io.github.flameyossnowy.tally.api.listener.RelationChangeEvent;
import io.github.flameyossnowy.tally.api.meta.RelationshipModel;
import io.github.flameyossnowy.tally.api.meta.RepositoryModel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The members of one many-to-many relation of one entity.
 * <p>
 * Adds and removes publish a notification carrying only the members that actually changed, and
 * nothing at all when nothing changed. A clear publishes a pre-clear notification before
 * unlinking and a post-clear notification after.
 *
 * @param <T> The owner's entity type
 */
public final class MemoryRelation<T> {
    private final MemoryRepositoryAdapter adapter;
    private final T owner;
    private final RepositoryModel<T, Object> ownerModel;
    private final RelationshipModel<T> relationship;

    MemoryRelation(
        @NotNull MemoryRepositoryAdapter adapter,
        @NotNull T owner,
        @NotNull RepositoryModel<T, Object> ownerModel,
        @NotNull RelationshipModel<T> relationship
    ) {
        this.adapter = adapter;
        this.owner = owner;
        this.ownerModel = ownerModel;
        this.relationship = relationship;
    }

    /**
     * Links members, given as entities or keys.
     *
     * @return the number of members that were not linked yet
     */
    public int add(@NotNull Object... members) {
        return addAll(Arrays.asList(members));
    }

    public int addAll(@NotNull Collection<?> members) {
        Object ownerId = adapter.requireId(ownerModel, owner);
        Set<Object> added = adapter.link(relationship, ownerId, memberIds(members));
        if (!added.isEmpty()) {
            publish(RelationAction.MEMBERS_ADDED, added);
        }
        return added.size();
    }

    /**
     * Unlinks members, given as entities or keys.
     *
     * @return the number of members that were linked
     */
    public int remove(@NotNull Object... members) {
        return removeAll(Arrays.asList(members));
    }

    public int removeAll(@NotNull Collection<?> members) {
        Object ownerId = adapter.requireId(ownerModel, owner);
        Set<Object> removed = adapter.unlink(relationship, ownerId, memberIds(members));
        if (!removed.isEmpty()) {
            publish(RelationAction.MEMBERS_REMOVED, removed);
        }
        return removed.size();
    }

    /**
     * Unlinks every member.
     *
     * @return the number of members that were linked
     */
    public int clear() {
        Object ownerId = adapter.requireId(ownerModel, owner);

        publish(RelationAction.PRE_CLEAR, null);
        Set<Object> removed = adapter.unlinkAll(relationship, ownerId);
        publish(RelationAction.POST_CLEAR, adapter.reportsClearedIds() ? removed : null);

        return removed.size();
    }

    public Set<Object> ids() {
        return adapter.memberIds(ownerModel.getEntityClass(), adapter.requireId(ownerModel, owner), relationship.fieldName());
    }

    public int count() {
        return ids().size();
    }

    public RelationshipModel<T> relationship() {
        return relationship;
    }

    private Set<Object> memberIds(Collection<?> members) {
        Set<Object> ids = new LinkedHashSet<>(members.size());
        for (Object member : members) {
            ids.add(adapter.memberIdOf(relationship, member));
        }
        return ids;
    }

    private void publish(RelationAction action, @Nullable Set<Object> memberIds) {
        adapter.publish(new RelationChangeEvent(
            relationship.linkName(),
            action,
            !relationship.isOwning(),
            owner,
            relationship.targetEntityType(),
            memberIds == null ? null : Collections.unmodifiableSet(memberIds)
        ));
    }
}
