package io.github.flameyossnowy.tally.api.options;

/**
 * A single predicate over one field of a row.
 */
public interface FilterOption {
    String key();

    String operator();

    Object value();
}
