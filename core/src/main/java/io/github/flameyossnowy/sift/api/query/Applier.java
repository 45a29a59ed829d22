package io.github.flameyossnowy.sift.api.query;

/**
 * Extension point for composing shared fragments into a builder.
 */
public interface Applier<T> {
    /**
     * Applies every function in order.
     */
    T apply(ApplyFunction<T>... functions);

    /**
     * Applies every function in order when {@code condition} holds, otherwise does nothing.
     */
    T applyIf(boolean condition, ApplyFunction<T>... functions);
}
