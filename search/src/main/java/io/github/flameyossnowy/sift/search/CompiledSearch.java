package io.github.flameyossnowy.sift.search;

import io.github.flameyossnowy.sift.api.query.ApplyFunction;
import io.github.flameyossnowy.sift.api.query.ConditionBuilder;
import io.github.flameyossnowy.sift.search.internal.OperatorDispatcher;
import io.github.flameyossnowy.sift.search.internal.ResolvedValue;
import io.github.flameyossnowy.sift.search.internal.ValueExtractor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.util.List;
import java.util.function.Function;

/**
 * The conditions of one filter class, ready to be applied to filter instances.
 * <p>
 * Instances are immutable; {@link #apply} may be called concurrently as long as each
 * call gets its own {@link ConditionBuilder}.
 *
 * @param <T> the filter class
 */
public final class CompiledSearch<T> {
    private final Class<T> type;
    private final List<Condition> conditions;
    private final ValueExtractor extractor;
    private final OperatorDispatcher dispatcher;
    private final Logger logger;

    CompiledSearch(Class<T> type, List<Condition> conditions, ValueExtractor extractor,
                   OperatorDispatcher dispatcher, Logger logger) {
        this.type = type;
        this.conditions = List.copyOf(conditions);
        this.extractor = extractor;
        this.dispatcher = dispatcher;
        this.logger = logger;
    }

    public Class<T> type() {
        return type;
    }

    public List<Condition> conditions() {
        return conditions;
    }

    /**
     * Adds one predicate per present field of {@code instance} to {@code builder}, in
     * condition order.
     * <p>
     * The first non-null {@code defaultAlias} qualifies columns whose condition declares
     * no alias of its own. A {@code null} instance, or one of another class, is logged
     * and leaves the builder untouched.
     */
    public void apply(@NotNull ConditionBuilder builder, @Nullable Object instance, String... defaultAlias) {
        if (instance == null) {
            logger.warn("Cannot apply search for {} to a null filter", type.getName());
            return;
        }
        if (!type.isInstance(instance)) {
            logger.warn("Cannot apply search for {} to an instance of {}", type.getName(), instance.getClass().getName());
            return;
        }

        String alias = firstNonNull(defaultAlias);
        for (Condition condition : conditions) {
            ResolvedValue resolved = extractor.extract(condition, instance);
            if (resolved.present()) {
                dispatcher.dispatch(builder, condition, resolved.value(), alias);
            }
        }
    }

    /**
     * Curried form of {@link #apply}, for use with {@link ConditionBuilder#apply}:
     * <pre>{@code builder.apply(search.applier().apply(filter));}</pre>
     */
    public Function<T, ApplyFunction<ConditionBuilder>> applier() {
        return instance -> builder -> {
            apply(builder, instance);
            return builder;
        };
    }

    public ApplyFunction<ConditionBuilder> applier(T instance, String... defaultAlias) {
        return builder -> {
            apply(builder, instance, defaultAlias);
            return builder;
        };
    }

    private static @Nullable String firstNonNull(String[] values) {
        if (values == null) return null;
        for (String value : values) {
            if (value != null) return value;
        }
        return null;
    }

    @Override
    public String toString() {
        return "CompiledSearch{" + type.getName() + ", conditions=" + conditions.size() + '}';
    }
}
