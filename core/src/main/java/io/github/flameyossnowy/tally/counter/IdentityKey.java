package io.github.flameyossnowy.tally.counter;

import org.jetbrains.annotations.NotNull;

import java.lang.ref.WeakReference;

/**
 * Map key comparing entities by identity without keeping them alive.
 * <p>
 * A key whose entity was collected is only equal to itself.
 */
final class IdentityKey {
    private final WeakReference<Object> reference;
    private final int hash;

    IdentityKey(@NotNull Object entity) {
        this.reference = new WeakReference<>(entity);
        this.hash = System.identityHashCode(entity);
    }

    boolean isAlive() {
        return reference.get() != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentityKey other)) return false;

        Object entity = reference.get();
        return entity != null && entity == other.reference.get();
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
