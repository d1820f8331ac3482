package io.github.flameyossnowy.tally.api.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A counter that tracks how many members there are on the other side of a relation.
 * <p>
 * The relation is named from the point of view of the annotated entity: either the name of a
 * {@link ManyToMany} field declared on it, or the {@code relatedName} another entity gave to
 * its {@link ManyToMany} or {@link ManyToOne} pointing at it.
 * <p>
 * The forward end of a {@link ManyToOne} and both ends of a {@link OneToOne} are rejected,
 * since there is only ever one member on that side.
 * <pre>{@code
 * public class Article {
 *     @Id Long id;
 *     @ManyToMany(target = Tag.class, relatedName = "articles") Set<Long> tags;
 *     @RelationCounter("tags") Integer tagCount;
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface RelationCounter {
    String value();
}
