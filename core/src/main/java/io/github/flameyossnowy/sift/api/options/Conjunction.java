package io.github.flameyossnowy.sift.api.options;

/**
 * How a filter joins the filters before it in the same scope.
 */
public enum Conjunction {
    AND,
    OR
}
