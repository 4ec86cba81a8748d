package com.jcollect.query;

import java.util.function.Predicate;

/**
 * A custom operator. Given the field path it is attached to and its operand, creates the test
 * applied to each item.
 * <pre>{@code
 * Validator isPast = (ref, expected) -> item -> {
 *     Object at = PathResolver.resolve(item, ref);
 *     return at instanceof Instant i && i.isBefore(Instant.now()) == (Boolean) expected;
 * };
 * }</pre>
 */
@FunctionalInterface
public interface Validator {
    Predicate<Object> create(String ref, Object operand);
}
