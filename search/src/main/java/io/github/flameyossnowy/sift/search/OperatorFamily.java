package io.github.flameyossnowy.sift.search;

/**
 * Groups operators that share value-extraction and dispatch rules.
 */
public enum OperatorFamily {
    /** Single value forwarded as-is. */
    COMPARISON,
    /** Two endpoints, read from a Range, a delimited string or a two-element sequence. */
    RANGE,
    /** A list of values, read from a delimited string or a sequence. */
    SET,
    /** A boolean gate: the condition fires only when the field is {@code true}. */
    NULL_CHECK,
    /** A non-empty string matched against one or more columns. */
    PATTERN
}
