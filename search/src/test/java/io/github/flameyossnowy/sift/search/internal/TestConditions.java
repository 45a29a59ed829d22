package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.search.Condition;
import io.github.flameyossnowy.sift.search.FieldPath;
import io.github.flameyossnowy.sift.search.Operator;

import java.util.List;
import java.util.Map;

final class TestConditions {
    static final class Holder {
        Object value;
    }

    private TestConditions() {
    }

    static Condition condition(Operator operator, Map<String, String> params, String... columns) {
        return condition(operator, null, params, columns);
    }

    static Condition condition(Operator operator, String alias, Map<String, String> params, String... columns) {
        try {
            FieldPath path = FieldPath.ROOT.append(Holder.class.getDeclaredField("value"), 0);
            return new Condition(path, List.of(columns), operator, alias, params);
        } catch (NoSuchFieldException e) {
            throw new AssertionError(e);
        }
    }
}
