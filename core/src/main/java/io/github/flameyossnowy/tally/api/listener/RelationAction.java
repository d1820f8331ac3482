package io.github.flameyossnowy.tally.api.listener;

public enum RelationAction {
    MEMBERS_ADDED,
    MEMBERS_REMOVED,

    /**
     * Sent before a clear is applied; the members are still linked.
     */
    PRE_CLEAR,

    /**
     * Sent after a clear was applied.
     */
    POST_CLEAR
}
