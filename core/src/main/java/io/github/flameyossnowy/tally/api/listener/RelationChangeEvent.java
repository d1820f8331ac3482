package io.github.flameyossnowy.tally.api.listener;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * A change to the members of a many-to-many link.
 *
 * @param linkName   the link that changed, shared by both of its sides
 * @param action     what happened
 * @param reverse    true if the change was made from the link's reverse (non-declaring) side
 * @param instance   the entity whose members changed
 * @param memberType the entity type on the other side of {@code instance}
 * @param memberIds  the ids that were added or removed. For clears this is null unless the
 *                   store reports the cleared ids.
 */
public record RelationChangeEvent(
    @NotNull String linkName,
    @NotNull RelationAction action,
    boolean reverse,
    @NotNull Object instance,
    @NotNull Class<?> memberType,
    @Nullable Set<Object> memberIds
) {
}
