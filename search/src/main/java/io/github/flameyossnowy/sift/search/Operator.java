package io.github.flameyossnowy.sift.search;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.github.flameyossnowy.sift.search.OperatorFamily.*;

/**
 * Operators accepted by the {@code @Search} annotation, keyed by their annotation token.
 */
public enum Operator {
    EQ("eq", COMPARISON),
    NEQ("neq", COMPARISON),
    GT("gt", COMPARISON),
    GTE("gte", COMPARISON),
    LT("lt", COMPARISON),
    LTE("lte", COMPARISON),

    BETWEEN("between", RANGE),
    NOT_BETWEEN("notBetween", RANGE),

    IN("in", SET),
    NOT_IN("notIn", SET),

    IS_NULL("isNull", NULL_CHECK),
    IS_NOT_NULL("isNotNull", NULL_CHECK),

    CONTAINS("contains", PatternKind.CONTAINS, false, false),
    NOT_CONTAINS("notContains", PatternKind.CONTAINS, true, false),
    STARTS_WITH("startsWith", PatternKind.STARTS_WITH, false, false),
    NOT_STARTS_WITH("notStartsWith", PatternKind.STARTS_WITH, true, false),
    ENDS_WITH("endsWith", PatternKind.ENDS_WITH, false, false),
    NOT_ENDS_WITH("notEndsWith", PatternKind.ENDS_WITH, true, false),
    CONTAINS_IGNORE_CASE("iContains", PatternKind.CONTAINS, false, true),
    NOT_CONTAINS_IGNORE_CASE("iNotContains", PatternKind.CONTAINS, true, true),
    STARTS_WITH_IGNORE_CASE("iStartsWith", PatternKind.STARTS_WITH, false, true),
    NOT_STARTS_WITH_IGNORE_CASE("iNotStartsWith", PatternKind.STARTS_WITH, true, true),
    ENDS_WITH_IGNORE_CASE("iEndsWith", PatternKind.ENDS_WITH, false, true),
    NOT_ENDS_WITH_IGNORE_CASE("iNotEndsWith", PatternKind.ENDS_WITH, true, true);

    /**
     * What a pattern operator matches against.
     */
    public enum PatternKind {
        CONTAINS,
        STARTS_WITH,
        ENDS_WITH
    }

    private static final Map<String, Operator> BY_TOKEN = Stream.of(values())
        .collect(Collectors.toUnmodifiableMap(op -> op.token.toLowerCase(Locale.ROOT), Function.identity()));

    private final String token;
    private final OperatorFamily family;
    private final PatternKind patternKind;
    private final boolean negated;
    private final boolean ignoreCase;

    Operator(String token, OperatorFamily family) {
        this.token = token;
        this.family = family;
        this.patternKind = null;
        this.negated = false;
        this.ignoreCase = false;
    }

    Operator(String token, PatternKind patternKind, boolean negated, boolean ignoreCase) {
        this.token = token;
        this.family = PATTERN;
        this.patternKind = patternKind;
        this.negated = negated;
        this.ignoreCase = ignoreCase;
    }

    /**
     * Looks an operator up by its annotation token, ignoring case.
     */
    public static Optional<Operator> fromToken(@NotNull String token) {
        return Optional.ofNullable(BY_TOKEN.get(token.trim().toLowerCase(Locale.ROOT)));
    }

    public String token() {
        return token;
    }

    public OperatorFamily family() {
        return family;
    }

    /**
     * The match kind of a pattern operator, {@code null} for the other families.
     */
    public PatternKind patternKind() {
        return patternKind;
    }

    public boolean negated() {
        return negated;
    }

    public boolean ignoreCase() {
        return ignoreCase;
    }

    @Override
    public String toString() {
        return token;
    }
}
