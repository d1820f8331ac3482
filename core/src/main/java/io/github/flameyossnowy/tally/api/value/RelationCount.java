package io.github.flameyossnowy.tally.api.value;

/**
 * Evaluates to the number of members currently on the other side of {@code relationName} for
 * the row being written.
 */
public record RelationCount(String relationName) implements DeferredExpression {
}
