package io.github.flameyossnowy.tally.counter;

/**
 * Configuration for a {@link RelationCounterRegistry}.
 *
 * @param reloadAfterWrite whether single-field increments and decrements read the stored value
 *                         back into the entity by default
 * @param eagerValidation  whether every registered entity's counters are validated when the
 *                         registry is built, instead of on first use of the entity type
 */
public record CounterConfig(
    boolean reloadAfterWrite,
    boolean eagerValidation
) {
    public static CounterConfig defaults() {
        return new CounterConfig(true, true);
    }

    public CounterConfig withReloadAfterWrite(boolean reloadAfterWrite) {
        return new CounterConfig(reloadAfterWrite, eagerValidation);
    }

    public CounterConfig withEagerValidation(boolean eagerValidation) {
        return new CounterConfig(reloadAfterWrite, eagerValidation);
    }
}
