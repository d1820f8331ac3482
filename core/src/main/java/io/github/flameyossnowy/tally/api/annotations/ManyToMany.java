package io.github.flameyossnowy.tally.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Many-to-many relationship annotation.
 * <p>
 * Declares the forward side of a link between this entity and {@link #target()}. The field
 * itself is declaration-only; members are added and removed through the store. The other
 * side of the link is reachable from {@link #target()} under {@link #relatedName()}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface ManyToMany {
    Class<?> target();

    String relatedName() default "";
}
