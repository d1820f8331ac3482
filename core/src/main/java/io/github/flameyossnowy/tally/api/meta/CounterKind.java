package io.github.flameyossnowy.tally.api.meta;

public enum CounterKind {
    NONE,
    COUNTER,
    RELATION_COUNTER
}
