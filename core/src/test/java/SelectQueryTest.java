import io.github.flameyossnowy.tally.api.options.FilterOption;
import io.github.flameyossnowy.tally.api.options.Query;
import io.github.flameyossnowy.tally.api.options.SelectOption;
import io.github.flameyossnowy.tally.api.options.SelectQuery;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectQueryTest {

    @Test
    void builderKeepsFiltersInOrder() {
        SelectQuery query = Query.select()
            .where("likes").gte(10)
            .where("score").isNotNull()
            .where("id").notIn(List.of(1L, 2L))
            .build();

        assertEquals(List.of(
            new SelectOption("likes", ">=", 10),
            new SelectOption("score", "IS NOT NULL", null),
            new SelectOption("id", "NOT IN", List.of(1L, 2L))
        ), query.filters());
    }

    @Test
    void byIds_uses_equality_for_a_single_key() {
        SelectQuery single = Query.byIds("id", List.of(7L));
        SelectQuery many = Query.byIds("id", List.of(7L, 8L));

        assertEquals(Query.byId("id", 7L), single);

        FilterOption filter = many.filters().get(0);
        assertEquals("IN", filter.operator());
        assertEquals(List.of(7L, 8L), filter.value());
    }

    @Test
    void filtersCannotBeModified() {
        SelectQuery query = Query.byId("id", 1L);
        assertThrows(UnsupportedOperationException.class, () -> query.filters().add(new SelectOption("id", "=", 2L)));
    }

    @Test
    void emptyQueryHasNoFilters() {
        assertTrue(Query.select().build().filters().isEmpty());
    }
}
