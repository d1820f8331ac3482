package io.github.flameyossnowy.tally.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the primary key of an entity.
 * <p>
 * Keys of type {@link Long} or {@link Integer} that are still {@code null} when the
 * entity is inserted are assigned by the store when {@link #autoIncrement()} is set.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Id {
    boolean autoIncrement() default true;
}
