package com.jcollect.query;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Equality, ordering and key coercion shared by the matcher, the aggregations and sorting.
 * Boxed numbers of different types compare by numeric value.
 */
public final class Values {
    private Values() {}

    public static boolean equal(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * Compares two values of the same kind, or returns {@code null} when they are not comparable
     * (either side missing, or mixed kinds such as a number against a string).
     */
    @SuppressWarnings("unchecked")
    public static Integer compare(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b);
        }
        if (left instanceof CharSequence a && right instanceof CharSequence b) {
            return a.toString().compareTo(b.toString());
        }
        if (left instanceof Comparable<?> comparable && left.getClass().isInstance(right)) {
            try {
                return ((Comparable<Object>) comparable).compareTo(right);
            } catch (ClassCastException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Coerces a grouping key to its string form. Integral doubles drop their fraction so that
     * {@code 2L} and {@code 2.0} land in the same bucket.
     */
    public static String keyOf(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == (long) d && !Double.isInfinite(d) && !Double.isNaN(d)) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return String.valueOf(value);
    }

    /**
     * Returns a hash key for {@code value} consistent with {@link #equal}: numbers of any boxed
     * type with the same value normalize to the same key.
     */
    public static Object normalize(Object value) {
        if (value instanceof Number n && isFinite(n)) {
            return toBigDecimal(n).stripTrailingZeros();
        }
        return value;
    }

    /**
     * Returns the numeric value of {@code value}, or {@code null} when it is not a number.
     */
    public static Double toDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        return null;
    }

    public static boolean isSequence(Object value) {
        return value instanceof Collection<?> || (value != null && value.getClass().isArray());
    }

    /**
     * Returns true when some element of a collection or array satisfies {@code test}.
     */
    public static boolean anyElement(Object sequence, Predicate<Object> test) {
        if (sequence instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (test.test(element)) {
                    return true;
                }
            }
            return false;
        }
        if (sequence != null && sequence.getClass().isArray()) {
            int length = Array.getLength(sequence);
            for (int i = 0; i < length; i++) {
                if (test.test(Array.get(sequence, i))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Copies the elements of a collection or array into an unmodifiable list that allows nulls.
     */
    public static List<Object> elements(Object sequence) {
        List<Object> elements = new ArrayList<>();
        anyElement(sequence, element -> !elements.add(element));
        return Collections.unmodifiableList(elements);
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static boolean isFinite(Number n) {
        return !(n instanceof Double || n instanceof Float) || Double.isFinite(n.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }
}
