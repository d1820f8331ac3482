package io.github.flameyossnowy.tally.api.value;

import org.jetbrains.annotations.Nullable;

/**
 * Computes the value of a counter from scratch.
 * <p>
 * Returning {@code null} leaves the counter untouched.
 *
 * @param <T> The entity type
 */
@FunctionalInterface
public interface CounterInitializer<T> {
    @Nullable
    CounterValue initialize(InitializerContext<T> context);

    /**
     * Marker used by {@link io.github.flameyossnowy.tally.api.annotations.Counter} when no
     * initializer is declared.
     */
    final class None implements CounterInitializer<Object> {
        @Override
        public @Nullable CounterValue initialize(InitializerContext<Object> context) {
            return null;
        }
    }
}
