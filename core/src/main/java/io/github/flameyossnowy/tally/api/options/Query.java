package io.github.flameyossnowy.tally.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;

/**
 * Factory for creating queries with convenient static methods.
 */
public sealed interface Query permits SelectQuery {

    /**
     * Start building a SELECT query.
     */
    static SelectQuery.SelectQueryBuilder select() {
        return new SelectQuery.SelectQueryBuilder();
    }

    /**
     * A query matching exactly one row by primary key.
     */
    static SelectQuery byId(@NotNull String idField, @NotNull Object id) {
        return select().where(idField).eq(id).build();
    }

    /**
     * A query matching every row whose primary key is in {@code ids}.
     * A single id is matched with equality instead of IN.
     */
    static SelectQuery byIds(@NotNull String idField, @NotNull Collection<?> ids) {
        if (ids.size() == 1) {
            return byId(idField, ids.iterator().next());
        }
        return select().where(idField).in(ids).build();
    }
}
