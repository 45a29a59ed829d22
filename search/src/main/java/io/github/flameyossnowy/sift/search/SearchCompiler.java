package io.github.flameyossnowy.sift.search;

import io.github.flameyossnowy.sift.search.internal.ConditionParser;
import io.github.flameyossnowy.sift.search.internal.OperatorDispatcher;
import io.github.flameyossnowy.sift.search.internal.ValueExtractor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.List;

/**
 * Compiles {@code @Search} annotated filter classes into {@link CompiledSearch}es.
 * <p>
 * Compilation walks the class once; the result is meant to be kept and reused.
 * See {@link Searches} for a shared cache.
 */
public final class SearchCompiler {
    private final SearchOptions options;
    private final ConditionParser parser;
    private final ValueExtractor extractor;
    private final OperatorDispatcher dispatcher;
    private final Logger logger;

    public SearchCompiler() {
        this(SearchOptions.defaults());
    }

    public SearchCompiler(@NotNull SearchOptions options) {
        this.options = options;
        this.logger = options.logger();
        this.parser = new ConditionParser(logger);
        this.extractor = new ValueExtractor(logger);
        this.dispatcher = new OperatorDispatcher(options);
    }

    public SearchOptions options() {
        return options;
    }

    public <T> @NotNull CompiledSearch<T> compile(@NotNull Class<T> type) {
        List<Condition> conditions = parser.parse(type);
        logger.debug("Compiled {} search conditions for {}", conditions.size(), type.getName());
        return new CompiledSearch<>(type, conditions, extractor, dispatcher, logger);
    }
}
