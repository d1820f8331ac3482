package io.github.flameyossnowy.tally.memory;

import io.github.flameyossnowy.tally.api.exceptions.StoreException;
import io.github.flameyossnowy.tally.api.options.FilterOption;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Evaluates {@link FilterOption}s against stored rows.
 * <p>
 * Numbers are compared by value regardless of their boxed type, so a {@code Long} key matches
 * an {@code Integer} literal. A {@code null} stored value only matches {@code IS NULL}.
 */
final class FilterEvaluator {
    private FilterEvaluator() {
        throw new AssertionError("No instances");
    }

    static boolean matchesAll(@NotNull Map<String, Object> row, @NotNull List<FilterOption> filters) {
        for (FilterOption filter : filters) {
            if (!matches(row, filter)) {
                return false;
            }
        }
        return true;
    }

    static boolean matches(@NotNull Map<String, Object> row, @NotNull FilterOption filter) {
        if (!row.containsKey(filter.key())) {
            throw new StoreException("Unknown field '" + filter.key() + "' in filter");
        }

        Object actual = row.get(filter.key());
        Object expected = filter.value();

        return switch (filter.operator()) {
            case "IS NULL" -> actual == null;
            case "IS NOT NULL" -> actual != null;
            case "IN" -> actual != null && contains(expected, actual);
            case "NOT IN" -> actual != null && !contains(expected, actual);
            default -> actual != null && compare(actual, filter.operator(), expected);
        };
    }

    private static boolean contains(@Nullable Object values, Object actual) {
        if (!(values instanceof Collection<?> collection)) {
            throw new StoreException("IN filters need a collection, got " + values);
        }

        for (Object value : collection) {
            if (equal(actual, value)) {
                return true;
            }
        }
        return false;
    }

    static boolean equal(@Nullable Object actual, @Nullable Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return compareNumbers(a, e) == 0;
        }
        return actual != null && actual.equals(expected);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static boolean compare(Object actual, String operator, @Nullable Object expected) {
        if (expected == null) {
            return false;
        }

        int result;
        if (actual instanceof Number a && expected instanceof Number e) {
            result = compareNumbers(a, e);
        } else if (operator.equals("=") || operator.equals("!=")) {
            result = actual.equals(expected) ? 0 : 1;
        } else if (actual instanceof Comparable comparable) {
            result = comparable.compareTo(expected);
        } else {
            throw new StoreException("Cannot compare " + actual + ' ' + operator + ' ' + expected);
        }

        return switch (operator) {
            case "=" -> result == 0;
            case "!=" -> result != 0;
            case ">" -> result > 0;
            case ">=" -> result >= 0;
            case "<" -> result < 0;
            case "<=" -> result <= 0;
            default -> throw new StoreException("Unsupported operator " + operator);
        };
    }

    private static int compareNumbers(Number a, Number e) {
        if (isIntegral(a) && isIntegral(e)) {
            return Long.compare(a.longValue(), e.longValue());
        }
        return Double.compare(a.doubleValue(), e.doubleValue());
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }
}
