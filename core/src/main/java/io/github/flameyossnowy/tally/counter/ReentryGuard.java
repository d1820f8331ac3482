package io.github.flameyossnowy.tally.counter;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which (entity instance, counter field) pairs are currently being initialized.
 * <p>
 * Entities are compared by identity, never by {@code equals}.
 */
public final class ReentryGuard {
    private final Set<Entry> held = ConcurrentHashMap.newKeySet();

    /**
     * Marks the pair as in flight.
     *
     * @return a token releasing the pair when closed, or null if the pair is already held
     */
    public @Nullable Token tryAcquire(@NotNull Object entity, @NotNull String field) {
        Entry entry = new Entry(entity, field);
        return held.add(entry) ? new Token(entry) : null;
    }

    public boolean isHeld(@NotNull Object entity, @NotNull String field) {
        return held.contains(new Entry(entity, field));
    }

    public boolean isEmpty() {
        return held.isEmpty();
    }

    public final class Token implements AutoCloseable {
        private final Entry entry;
        private boolean released;

        private Token(Entry entry) {
            this.entry = entry;
        }

        @Override
        public void close() {
            if (released) return;
            released = true;
            held.remove(entry);
        }
    }

    private static final class Entry {
        private final Object entity;
        private final String field;

        Entry(Object entity, String field) {
            this.entity = entity;
            this.field = field;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry other)) return false;
            return entity == other.entity && field.equals(other.field);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(entity) + field.hashCode();
        }
    }
}
