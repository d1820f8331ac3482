package io.github.flameyossnowy.tally.api.value;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The result of a counter initializer: either a value known now, or an expression the store
 * evaluates at write time.
 */
public sealed interface CounterValue permits CounterValue.Concrete, CounterValue.Deferred {

    @Contract(pure = true)
    static @NotNull Concrete of(int value) {
        return new Concrete(value);
    }

    @Contract(pure = true)
    static @NotNull Deferred deferred(@NotNull DeferredExpression expression) {
        return new Deferred(expression);
    }

    record Concrete(int value) implements CounterValue {
    }

    record Deferred(@NotNull DeferredExpression expression) implements CounterValue {
        public Deferred {
            if (expression == null) {
                throw new IllegalArgumentException("Deferred counter expression cannot be null");
            }
        }
    }
}
