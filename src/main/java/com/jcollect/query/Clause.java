package com.jcollect.query;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A compiled clause, evaluated by {@link QueryMatcher} against the value resolved at a field path.
 */
public sealed interface Clause {
    /** A built-in operator applied to the resolved value. Literal clauses compile to {@code EQ}. */
    record Comparison(Operator operator, Object operand) implements Clause {}

    /** A regular expression literal; matches when the resolved string contains a match. */
    record Matches(Pattern pattern) implements Clause {}

    record Not(Clause clause) implements Clause {}

    /** Several operators of one operator map, AND-combined. */
    record AllOf(List<Clause> clauses) implements Clause {}

    /** A custom validator bound to its field and operand; tests the whole item. */
    record Custom(String name, Predicate<Object> test) implements Clause {}
}
