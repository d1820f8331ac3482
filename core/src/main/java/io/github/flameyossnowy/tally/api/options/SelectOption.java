package io.github.flameyossnowy.tally.api.options;

public record SelectOption(String key, String operator, Object value) implements FilterOption {
}
