package io.github.flameyossnowy.sift.api.query;

/**
 * A reusable fragment applied to a builder, returning the builder to continue the chain.
 */
@FunctionalInterface
public interface ApplyFunction<T> {
    T apply(T target);
}
