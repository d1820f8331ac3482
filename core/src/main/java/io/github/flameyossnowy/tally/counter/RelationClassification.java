package io.github.flameyossnowy.tally.counter;

import io.github.flameyossnowy.tally.api.exceptions.RelationConfigurationException;
import io.github.flameyossnowy.tally.api.meta.RelationshipModel;
import org.jetbrains.annotations.NotNull;

/**
 * How a counted relation looks from its owner's side, which decides the notifications a
 * {@link RelationTracker} listens to.
 */
public enum RelationClassification {
    /**
     * The declaring side of a many-to-many link.
     */
    FORWARD_MULTI(false),
    /**
     * The non-declaring side of a many-to-many link.
     */
    REVERSE_MULTI(true),
    /**
     * The "one" side of a foreign key, counting the rows that reference it.
     */
    REVERSE_SINGLE(true);

    private final boolean reverse;

    RelationClassification(boolean reverse) {
        this.reverse = reverse;
    }

    public boolean isReverse() {
        return reverse;
    }

    /**
     * Classifies a relation seen from its owner.
     *
     * @throws RelationConfigurationException if the relation is single-valued on the owner's side
     */
    public static RelationClassification of(@NotNull RelationshipModel<?> relationship) {
        return switch (relationship.relationshipKind()) {
            case MANY_TO_MANY -> relationship.isOwning() ? FORWARD_MULTI : REVERSE_MULTI;
            case ONE_TO_MANY -> REVERSE_SINGLE;
            case MANY_TO_ONE, ONE_TO_ONE -> throw new RelationConfigurationException(
                "Relation '" + relationship.fieldName() + "' on " + relationship.declaringEntityType().getSimpleName()
                    + " is single-valued (" + relationship.relationshipKind() + ") and cannot be counted",
                relationship.declaringEntityType(),
                relationship.fieldName());
        };
    }
}
