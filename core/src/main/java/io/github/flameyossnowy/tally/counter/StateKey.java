package io.github.flameyossnowy.tally.counter;

import org.jetbrains.annotations.NotNull;

/**
 * Identifies one logical row and one relation: every loaded representation of that row shares
 * the key.
 */
public record StateKey(
    @NotNull Class<?> entityType,
    @NotNull Object id,
    @NotNull String relationName
) {
    @Override
    public String toString() {
        return entityType.getSimpleName() + '[' + id + "]." + relationName;
    }
}
