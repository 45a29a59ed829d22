package io.github.flameyossnowy.sift.api.options;

public record SelectOption(
    Conjunction conjunction,
    String option,      // column, possibly alias-qualified
    String operator,    // =, BETWEEN, IN, CONTAINS, ... (see FilterTreeBuilder)
    Object value        // null for IS NULL / IS NOT NULL, Range for BETWEEN, List for IN
) implements FilterOption {}
