package com.jcollect.query;

import com.jcollect.path.PathResolver;

import java.util.function.IntPredicate;

public class QueryMatcher {
    public boolean matches(QueryNode node, Object item) {
        if (node instanceof QueryNode.Always) {
            return true;
        }
        if (node instanceof QueryNode.FieldMatch match) {
            return evaluate(match.clause(), item, PathResolver.resolve(item, match.path()));
        }
        if (node instanceof QueryNode.And and) {
            for (QueryNode child : and.nodes()) {
                if (!matches(child, item)) {
                    return false;
                }
            }
            return true;
        }
        if (node instanceof QueryNode.Not not) {
            return !matches(not.node(), item);
        }
        throw new IllegalStateException("Unknown query node: " + node);
    }

    /**
     * Evaluates {@code clause} against {@code value}, the value resolved at the clause's field in
     * {@code item}.
     */
    public boolean evaluate(Clause clause, Object item, Object value) {
        if (clause instanceof Clause.Comparison comparison) {
            return compare(comparison.operator(), value, comparison.operand());
        }
        if (clause instanceof Clause.Matches regex) {
            return value instanceof CharSequence text && regex.pattern().matcher(text).find();
        }
        if (clause instanceof Clause.Not not) {
            return !evaluate(not.clause(), item, value);
        }
        if (clause instanceof Clause.AllOf all) {
            for (Clause child : all.clauses()) {
                if (!evaluate(child, item, value)) {
                    return false;
                }
            }
            return true;
        }
        if (clause instanceof Clause.Custom custom) {
            return custom.test().test(item);
        }
        throw new IllegalStateException("Unknown clause: " + clause);
    }

    private boolean compare(Operator operator, Object value, Object operand) {
        return switch (operator) {
            case EQ -> Values.equal(value, operand);
            case GT -> ordered(value, operand, c -> c > 0);
            case GTE -> ordered(value, operand, c -> c >= 0);
            case LT -> ordered(value, operand, c -> c < 0);
            case LTE -> ordered(value, operand, c -> c <= 0);
            case IN -> Values.anyElement(operand, element -> Values.equal(value, element));
            case CONTAINS -> contains(value, operand);
        };
    }

    private static boolean ordered(Object value, Object operand, IntPredicate test) {
        Integer compared = Values.compare(value, operand);
        return compared != null && test.test(compared);
    }

    private static boolean contains(Object value, Object operand) {
        if (value instanceof CharSequence text) {
            return operand instanceof CharSequence needle && text.toString().contains(needle);
        }
        return Values.anyElement(value, element -> Values.equal(element, operand));
    }
}
