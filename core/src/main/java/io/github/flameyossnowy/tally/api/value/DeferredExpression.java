package io.github.flameyossnowy.tally.api.value;

/**
 * An opaque expression evaluated by the store while writing a counter, per matched row.
 * <p>
 * Stores reject expressions they do not understand.
 *
 * @see RelationCount
 */
public interface DeferredExpression {
}
