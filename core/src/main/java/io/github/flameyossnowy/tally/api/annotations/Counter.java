package io.github.flameyossnowy.tally.api.annotations;

import io.github.flameyossnowy.tally.api.value.CounterInitializer;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * An integer field that is only ever changed through atomic deltas.
 * <p>
 * Counter fields are never part of a generic "write every field" update unless they are
 * explicitly requested or being reset to {@code null}, so a stale in-memory value cannot
 * clobber deltas applied concurrently by someone else.
 * <p>
 * The field must be declared as {@link Integer}; {@code null} means "not initialized yet".
 *
 * @see RelationCounter
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Counter {
    /**
     * Computes the value of the counter when it is first loaded as {@code null}, or when it is
     * re-initialized. Must have a public no-arg constructor.
     */
    @SuppressWarnings("rawtypes")
    Class<? extends CounterInitializer> initializer() default CounterInitializer.None.class;

    /**
     * Value stored on insert when the field is {@code null}. Empty means no default.
     */
    String defaultValue() default "";
}
