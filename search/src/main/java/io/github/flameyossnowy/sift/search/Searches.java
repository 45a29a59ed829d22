package io.github.flameyossnowy.sift.search;

import io.github.flameyossnowy.sift.api.query.ApplyFunction;
import io.github.flameyossnowy.sift.api.query.ConditionBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide cache of searches compiled with {@link SearchOptions#defaults()}.
 */
public final class Searches {
    private static final SearchCompiler COMPILER = new SearchCompiler();
    private static final Map<Class<?>, CompiledSearch<?>> CACHE = new ConcurrentHashMap<>();

    private Searches() {
    }

    @SuppressWarnings("unchecked")
    public static <T> @NotNull CompiledSearch<T> forType(@NotNull Class<T> type) {
        return (CompiledSearch<T>) CACHE.computeIfAbsent(type, COMPILER::compile);
    }

    public static <T> @NotNull Function<T, ApplyFunction<ConditionBuilder>> applier(@NotNull Class<T> type) {
        return forType(type).applier();
    }

    public static void clear() {
        CACHE.clear();
    }
}
