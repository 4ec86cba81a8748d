package com.jcollect.aggregate;

import com.jcollect.path.PathResolver;
import com.jcollect.query.ItemPredicate;
import com.jcollect.query.Values;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableDoubleList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.factory.primitive.DoubleLists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Grouping, counting, keying, partitioning and numeric folds over an ordered list of items.
 * Keyed results are insertion-ordered by first-seen key; keys are coerced with
 * {@link Values#keyOf(Object)}.
 */
public final class Aggregations {
    private Aggregations() {}

    /** Extracts the value at {@code path} from each item. */
    public static <T> ItemFunction<T, Object> key(String path) {
        return (item, index) -> PathResolver.resolve(item, path);
    }

    public static <T> Map<String, MutableList<T>> groupBy(ListIterable<T> items, ItemFunction<? super T, ?> keyFn) {
        Map<String, MutableList<T>> groups = new LinkedHashMap<>();
        items.forEachWithIndex((item, index) ->
                groups.computeIfAbsent(Values.keyOf(keyFn.apply(item, index)), k -> Lists.mutable.empty()).add(item));
        return groups;
    }

    public static <T> Map<String, Integer> countBy(ListIterable<T> items, ItemFunction<? super T, ?> keyFn) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        items.forEachWithIndex((item, index) -> counts.merge(Values.keyOf(keyFn.apply(item, index)), 1, Integer::sum));
        return counts;
    }

    /** Maps each key to a single item; a later item with the same key replaces the earlier one. */
    public static <T> Map<String, T> keyBy(ListIterable<T> items, ItemFunction<? super T, ?> keyFn) {
        Map<String, T> keyed = new LinkedHashMap<>();
        items.forEachWithIndex((item, index) -> keyed.put(Values.keyOf(keyFn.apply(item, index)), item));
        return keyed;
    }

    /** Splits into (matching, non-matching), each in original relative order. */
    public static <T> Pair<MutableList<T>, MutableList<T>> partition(ListIterable<T> items,
                                                                     ItemPredicate<? super T> predicate) {
        MutableList<T> matching = Lists.mutable.empty();
        MutableList<T> rest = Lists.mutable.empty();
        items.forEachWithIndex((item, index) -> (predicate.test(item, index) ? matching : rest).add(item));
        return Tuples.pair(matching, rest);
    }

    /** Keeps the first item for each distinct key. */
    public static <T> MutableList<T> unique(ListIterable<T> items, ItemFunction<? super T, ?> keyFn) {
        Set<Object> seen = Sets.mutable.empty();
        MutableList<T> result = Lists.mutable.empty();
        items.forEachWithIndex((item, index) -> {
            if (seen.add(Values.normalize(keyFn.apply(item, index)))) {
                result.add(item);
            }
        });
        return result;
    }

    public static <T, A> A reduce(ListIterable<T> items, ItemReducer<A, ? super T> reducer, A initial) {
        A accumulator = initial;
        for (int i = 0; i < items.size(); i++) {
            accumulator = reducer.apply(accumulator, items.get(i), i);
        }
        return accumulator;
    }

    /** Sum of the numeric values produced by {@code valueFn}; non-numeric values are skipped. */
    public static <T> double sum(ListIterable<T> items, ItemFunction<? super T, ?> valueFn) {
        return numbers(items, valueFn).sum();
    }

    public static <T> Double avg(ListIterable<T> items, ItemFunction<? super T, ?> valueFn) {
        MutableDoubleList values = numbers(items, valueFn);
        return values.isEmpty() ? null : values.average();
    }

    public static <T> Double min(ListIterable<T> items, ItemFunction<? super T, ?> valueFn) {
        MutableDoubleList values = numbers(items, valueFn);
        return values.isEmpty() ? null : values.min();
    }

    public static <T> Double max(ListIterable<T> items, ItemFunction<? super T, ?> valueFn) {
        MutableDoubleList values = numbers(items, valueFn);
        return values.isEmpty() ? null : values.max();
    }

    private static <T> MutableDoubleList numbers(ListIterable<T> items, ItemFunction<? super T, ?> valueFn) {
        MutableDoubleList values = DoubleLists.mutable.empty();
        items.forEachWithIndex((item, index) -> {
            Double value = Values.toDouble(valueFn.apply(item, index));
            if (value != null) {
                values.add(value);
            }
        });
        return values;
    }
}
