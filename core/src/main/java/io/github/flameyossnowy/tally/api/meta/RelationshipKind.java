package io.github.flameyossnowy.tally.api.meta;

public enum RelationshipKind {
    ONE_TO_ONE,
    ONE_TO_MANY,
    MANY_TO_ONE,
    MANY_TO_MANY
}
