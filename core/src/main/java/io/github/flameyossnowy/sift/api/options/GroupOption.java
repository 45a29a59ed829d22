package io.github.flameyossnowy.sift.api.options;

import java.util.List;

public record GroupOption(Conjunction conjunction, List<FilterOption> filters) implements FilterOption {
    public GroupOption {
        filters = List.copyOf(filters);
    }
}
