package com.jcollect.collection;

import com.jcollect.aggregate.ItemFunction;
import com.jcollect.aggregate.ItemReducer;
import com.jcollect.query.ItemPredicate;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Applies a named operation with loosely-typed arguments to a collection, the way an operation
 * log entry {@code [method, ...args]} describes it. Chainable operations return a collection,
 * terminal ones a scalar or a map.
 */
public final class CollectionOperations {
    private static final ImmutableSet<String> SUPPORTED = Sets.immutable.with(
            "where", "whereNot", "filter", "not", "first", "last", "find", "contains", "every", "each",
            "map", "unique", "chunk", "reverse", "slice", "concat", "union", "sort", "sortBy", "sortByDesc",
            "shuffle", "paginate", "groupBy", "countBy", "keyBy", "partition", "reduce",
            "sum", "avg", "min", "max", "delete", "update", "forget", "push", "unshift", "pop", "shift",
            "length", "size", "isEmpty", "isNotEmpty", "get", "at", "random", "join", "toList", "toJson",
            "stringify", "dump", "dd", "macro", "collect", "clone");

    private CollectionOperations() {}

    public static boolean supports(String method) {
        return SUPPORTED.contains(method);
    }

    /**
     * @throws IllegalArgumentException for an unsupported method or arguments of the wrong shape
     */
    @SuppressWarnings("unchecked")
    public static Object apply(ItemCollection<?> target, String method, Object... args) {
        ItemCollection<Object> c = (ItemCollection<Object>) target;
        Object[] a = args == null ? new Object[0] : args;
        try {
            return switch (method) {
                case "where" -> a.length == 3
                        ? c.where(string(a, 0), string(a, 1), a[2])
                        : c.where(string(a, 0), arg(a, 1, 2));
                case "whereNot" -> a.length == 3
                        ? c.whereNot(string(a, 0), string(a, 1), a[2])
                        : c.whereNot(string(a, 0), arg(a, 1, 2));
                case "filter" -> isQuery(a) ? c.filter(query(a)) : c.filter(predicate(a, 0));
                case "not" -> isQuery(a) ? c.not(query(a)) : c.not(predicate(a, 0));
                case "first" -> a.length == 0 ? c.first() : isQuery(a) ? c.first(query(a)) : c.first(predicate(a, 0));
                case "last" -> a.length == 0 ? c.last() : isQuery(a) ? c.last(query(a)) : c.last(predicate(a, 0));
                case "find" -> isQuery(a) ? c.find(query(a)) : c.find(predicate(a, 0));
                case "contains" -> isQuery(a) ? c.contains(query(a)) : c.contains(predicate(a, 0));
                case "every" -> every(c, a);
                case "each" -> c.each(predicate(a, 0));
                case "map" -> c.map(function(a, 0));
                case "unique" -> a.length == 0 ? c.unique()
                        : a[0] instanceof String key ? c.unique(key) : c.unique(function(a, 0));
                case "chunk" -> c.chunk(integer(a, 0));
                case "reverse" -> c.reverse();
                case "slice" -> a.length > 1 ? c.slice(integer(a, 0), integer(a, 1)) : c.slice(integer(a, 0));
                case "concat" -> c.concat(iterable(a, 0));
                case "union" -> c.union(iterable(a, 0));
                case "sort" -> sort(c, a);
                case "sortBy" -> a[0] instanceof String key ? c.sortBy(key) : c.sortBy(function(a, 0));
                case "sortByDesc" -> a[0] instanceof String key ? c.sortByDesc(key) : c.sortByDesc(function(a, 0));
                case "shuffle" -> a.length > 0 && a[0] instanceof Random random ? c.shuffle(random) : c.shuffle();
                case "paginate" -> c.paginate(a.length > 0 ? integer(a, 0) : 1, a.length > 1 ? integer(a, 1) : 20);
                case "groupBy" -> a[0] instanceof String key ? c.groupBy(key) : c.groupBy(function(a, 0));
                case "countBy" -> a[0] instanceof String key ? c.countBy(key) : c.countBy(function(a, 0));
                case "keyBy" -> a[0] instanceof String key ? c.keyBy(key) : c.keyBy(function(a, 0));
                case "partition" -> isQuery(a) ? c.partition(query(a)) : c.partition(predicate(a, 0));
                case "reduce" -> c.reduce((ItemReducer<Object, Object>) a[0], arg(a, 1, 2));
                case "sum" -> a.length == 0 ? c.sum() : a[0] instanceof String key ? c.sum(key) : c.sum(function(a, 0));
                case "avg" -> a.length == 0 ? c.avg() : a[0] instanceof String key ? c.avg(key) : c.avg(function(a, 0));
                case "min" -> a.length == 0 ? c.min() : a[0] instanceof String key ? c.min(key) : c.min(function(a, 0));
                case "max" -> a.length == 0 ? c.max() : a[0] instanceof String key ? c.max(key) : c.max(function(a, 0));
                case "delete" -> isQuery(a) ? c.delete(query(a)) : c.delete(predicate(a, 0));
                case "update" -> update(c, a);
                case "forget" -> c.forget(strings(a));
                case "push" -> c.push(a);
                case "unshift" -> c.unshift(a);
                case "pop" -> c.pop();
                case "shift" -> c.shift();
                case "length", "size" -> c.size();
                case "isEmpty" -> c.isEmpty();
                case "isNotEmpty" -> c.isNotEmpty();
                case "get", "at" -> c.get(integer(a, 0));
                case "random" -> a.length == 0 ? c.random() : c.random(integer(a, 0));
                case "join" -> switch (a.length) {
                    case 1 -> c.join(string(a, 0));
                    case 2 -> c.join(string(a, 0), string(a, 1));
                    default -> c.join(string(a, 0), string(a, 1), string(a, 2));
                };
                case "toList" -> c.toList();
                case "toJson" -> c.toJson();
                case "stringify" -> a.length > 0 && Boolean.TRUE.equals(a[0]) ? c.stringify(true) : c.stringify();
                case "dump" -> c.dump();
                case "dd" -> c.dd();
                case "macro" -> c.macro(string(a, 0), (Macro) a[1]);
                case "collect" -> a.length == 0 ? c.collect() : c.collect(iterable(a, 0));
                case "clone" -> c.clone();
                default -> throw new IllegalArgumentException("Unsupported collection operation: " + method);
            };
        } catch (ClassCastException | ArrayIndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Invalid arguments for " + method + ": " + Arrays.toString(a), e);
        }
    }

    private static Object every(ItemCollection<Object> c, Object[] a) {
        if (a.length == 3) {
            return c.every(string(a, 0), string(a, 1), a[2]);
        }
        if (a.length == 2) {
            return c.every(string(a, 0), a[1]);
        }
        if (a[0] instanceof String key) {
            return c.every(key);
        }
        return isQuery(a) ? c.every(query(a)) : c.every(predicate(a, 0));
    }

    @SuppressWarnings("unchecked")
    private static Object sort(ItemCollection<Object> c, Object[] a) {
        if (a.length == 0 || a[0] == null) {
            return c.sort();
        }
        if (a[0] instanceof Comparator<?> comparator) {
            return c.sort((Comparator<Object>) comparator);
        }
        return a.length > 1 ? c.sort(string(a, 0), string(a, 1)) : c.sort(string(a, 0));
    }

    @SuppressWarnings("unchecked")
    private static Object update(ItemCollection<Object> c, Object[] a) {
        if (a.length == 1) {
            return c.update((Map<String, ?>) a[0]);
        }
        if (a[0] instanceof Map<?, ?>) {
            return a[1] instanceof Map<?, ?>
                    ? c.update(query(a), (Map<String, ?>) a[1])
                    : c.update(query(a), (ItemFunction<Object, Object>) a[1]);
        }
        ItemPredicate<Object> where = predicate(a, 0);
        return a[1] instanceof Map<?, ?>
                ? c.update(where, (Map<String, ?>) a[1])
                : c.update(where, (ItemFunction<Object, Object>) a[1]);
    }

    private static boolean isQuery(Object[] a) {
        return a.length > 0 && a[0] instanceof Map<?, ?>;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> query(Object[] a) {
        return (Map<String, ?>) a[0];
    }

    @SuppressWarnings("unchecked")
    private static ItemPredicate<Object> predicate(Object[] a, int i) {
        return (ItemPredicate<Object>) a[i];
    }

    @SuppressWarnings("unchecked")
    private static ItemFunction<Object, Object> function(Object[] a, int i) {
        return (ItemFunction<Object, Object>) a[i];
    }

    @SuppressWarnings("unchecked")
    private static Iterable<Object> iterable(Object[] a, int i) {
        return (Iterable<Object>) a[i];
    }

    private static String string(Object[] a, int i) {
        return (String) a[i];
    }

    private static int integer(Object[] a, int i) {
        return ((Number) a[i]).intValue();
    }

    /** {@code a[i]} when {@code a} has exactly {@code length} elements. */
    private static Object arg(Object[] a, int i, int length) {
        if (a.length != length) {
            throw new IllegalArgumentException("Expected " + length + " arguments, got " + a.length);
        }
        return a[i];
    }

    private static String[] strings(Object[] a) {
        if (a.length == 1 && a[0] instanceof Iterable<?> keys) {
            List<String> names = new ArrayList<>();
            keys.forEach(key -> names.add((String) key));
            return names.toArray(new String[0]);
        }
        String[] names = new String[a.length];
        for (int i = 0; i < a.length; i++) {
            names[i] = (String) a[i];
        }
        return names;
    }
}
