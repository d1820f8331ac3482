package io.github.flameyossnowy.tally.api.options;

import org.jetbrains.annotations.Contract;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable query description used by stores.
 *
 * <p>This query model is intentionally backend-agnostic. Every filter must hold for a row
 * to match; a query without filters matches every row.</p>
 *
 * <p>Instances should be constructed exclusively through
 * {@link SelectQueryBuilder}.</p>
 */
public record SelectQuery(List<FilterOption> filters) implements Query {

    public SelectQuery {
        filters = List.copyOf(filters);
    }

    /**
     * Fluent builder for {@link SelectQuery}.
     *
     * <p>The API is field-scoped and operator-driven:
     * {@code where("articleCount").gte(18)} instead of constructing filter objects
     * manually.</p>
     */
    public static class SelectQueryBuilder {

        private final List<FilterOption> filters = new ArrayList<>();

        /**
         * Begins a filter clause for the given field.
         *
         * <pre>{@code
         * Query.select()
         *   .where("id").in(List.of(1L, 2L))
         *   .where("tagCount").gt(0)
         *   .build();
         * }</pre>
         */
        public QueryField where(String field) {
            return new QueryField(this, field);
        }

        public SelectQueryBuilder where(List<FilterOption> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(new ArrayList<>(filters));
        }

        void addFilter(FilterOption filter) {
            filters.add(filter);
        }

        /**
         * Field-scoped operator builder.
         *
         * <p>Ensures operators are attached to a concrete field and prevents
         * malformed filter construction.</p>
         */
        @SuppressWarnings("unused")
        public static class QueryField {
            private final SelectQueryBuilder builder;
            private final String field;

            @Contract(pure = true)
            QueryField(SelectQueryBuilder builder, String field) {
                this.builder = builder;
                this.field = field;
            }

            private SelectQueryBuilder add(String operator, Object value) {
                builder.addFilter(new SelectOption(field, operator, value));
                return builder;
            }

            public SelectQueryBuilder eq(Object value) { return add("=", value); }

            public SelectQueryBuilder ne(Object value) { return add("!=", value); }

            public SelectQueryBuilder gt(Object value) { return add(">", value); }

            public SelectQueryBuilder gte(Object value) { return add(">=", value); }

            public SelectQueryBuilder lt(Object value) { return add("<", value); }

            public SelectQueryBuilder lte(Object value) { return add("<=", value); }

            public SelectQueryBuilder in(Collection<?> values) { return add("IN", List.copyOf(values)); }

            public SelectQueryBuilder notIn(Collection<?> values) { return add("NOT IN", List.copyOf(values)); }

            public SelectQueryBuilder isNull() { return add("IS NULL", null); }

            public SelectQueryBuilder isNotNull() { return add("IS NOT NULL", null); }
        }
    }
}
