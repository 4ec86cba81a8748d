package com.jcollect.collection;

import com.jcollect.aggregate.Aggregations;
import com.jcollect.aggregate.ItemFunction;
import com.jcollect.aggregate.ItemReducer;
import com.jcollect.output.OutputFormatter;
import com.jcollect.path.PathResolver;
import com.jcollect.query.ItemPredicate;
import com.jcollect.query.QueryCompiler;
import com.jcollect.query.ValidatorMap;
import com.jcollect.query.Values;
import com.jcollect.query.WhereOperator;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.tuple.Tuples;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * An ordered, owned sequence of items with a chainable query API.
 * <p>
 * Methods fall into three groups:
 * <ul>
 *   <li>pure methods ({@code filter}, {@code where}, {@code map}, {@code sortBy}, ...) return a new
 *   collection and leave the receiver untouched;</li>
 *   <li>mutating methods ({@code delete}, {@code update}, {@code forget}, {@code sort},
 *   {@code shuffle}, {@code push}, ...) change the receiver in place and return it;</li>
 *   <li>terminal methods ({@code sum}, {@code first}, {@code join}, ...) return a scalar.</li>
 * </ul>
 * Derived collections share the receiver's validators and macro registry but own their list.
 * Queries are either {@code Map} specifications compiled by {@link QueryCompiler} or
 * {@link ItemPredicate}s:
 * <pre>{@code
 * ItemCollection<Map<String, Object>> adults = users.filter(Map.of("age", Map.of("$gte", 18)));
 * ItemCollection<Map<String, Object>> same = users.where("age", ">=", 18);
 * }</pre>
 *
 * @param <T> item type
 */
public class ItemCollection<T> implements Iterable<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemCollection.class);

    private static final OutputFormatter COMPACT = new OutputFormatter(false);
    private static final OutputFormatter PRETTY = new OutputFormatter(true);

    private final MutableList<T> items;
    private final QueryCompiler compiler;
    private final MacroRegistry macros;

    public ItemCollection() {
        this(null);
    }

    public ItemCollection(Iterable<? extends T> items) {
        this(items, ValidatorMap.empty());
    }

    public ItemCollection(Iterable<? extends T> items, ValidatorMap validators) {
        this(items, validators, MacroRegistry.shared());
    }

    /**
     * @param items      initial items, copied
     * @param validators custom operators available to this collection's queries
     * @param parent     registry consulted after this collection's own macros
     */
    public ItemCollection(Iterable<? extends T> items, ValidatorMap validators, MacroRegistry parent) {
        this(copyOf(items), new QueryCompiler(validators), new MacroRegistry(parent));
    }

    private ItemCollection(MutableList<T> items, QueryCompiler compiler, MacroRegistry macros) {
        this.items = items;
        this.compiler = compiler;
        this.macros = macros;
    }

    @SafeVarargs
    public static <T> ItemCollection<T> of(T... items) {
        return new ItemCollection<>(Arrays.asList(items));
    }

    /**
     * Registers a macro for every collection that uses the shared registry.
     *
     * @throws MacroCollisionException if {@code name} is a built-in method name
     */
    public static void sharedMacro(String name, Macro macro) {
        MacroRegistry.shared().register(name, macro);
    }

    // ------------------------------------------------------------------
    // Filtering
    // ------------------------------------------------------------------

    public ItemCollection<T> filter(Map<String, ?> query) {
        return select(compiler.compile(query));
    }

    public ItemCollection<T> filter(ItemPredicate<? super T> predicate) {
        return select(predicate);
    }

    public ItemCollection<T> not(Map<String, ?> query) {
        return select(compiler.<T>compile(query).negate());
    }

    public ItemCollection<T> not(ItemPredicate<? super T> predicate) {
        return select((item, index) -> !predicate.test(item, index));
    }

    /** Items whose value at {@code key} equals {@code value}. Dot notation reaches nested fields. */
    public ItemCollection<T> where(String key, Object value) {
        return filter(WhereOperator.toSpec(key, value));
    }

    /**
     * Items whose value at {@code key} compares to {@code value} with {@code operator}, one of
     * {@code = != > < >= <= in includes}.
     */
    public ItemCollection<T> where(String key, String operator, Object value) {
        return filter(WhereOperator.toSpec(key, operator, value));
    }

    public ItemCollection<T> whereNot(String key, Object value) {
        return not(WhereOperator.toSpec(key, value));
    }

    public ItemCollection<T> whereNot(String key, String operator, Object value) {
        return not(WhereOperator.toSpec(key, operator, value));
    }

    private ItemCollection<T> select(ItemPredicate<? super T> predicate) {
        MutableList<T> selected = Lists.mutable.empty();
        items.forEachWithIndex((item, index) -> {
            if (predicate.test(item, index)) {
                selected.add(item);
            }
        });
        return derive(selected);
    }

    // ------------------------------------------------------------------
    // Finders
    // ------------------------------------------------------------------

    public T first() {
        return items.isEmpty() ? null : items.getFirst();
    }

    public T first(Map<String, ?> query) {
        return firstMatch(compiler.compile(query));
    }

    public T first(ItemPredicate<? super T> predicate) {
        return firstMatch(predicate);
    }

    public T last() {
        return items.isEmpty() ? null : items.getLast();
    }

    public T last(Map<String, ?> query) {
        return lastMatch(compiler.compile(query));
    }

    public T last(ItemPredicate<? super T> predicate) {
        return lastMatch(predicate);
    }

    public T find(Map<String, ?> query) {
        return first(query);
    }

    public T find(ItemPredicate<? super T> predicate) {
        return first(predicate);
    }

    public boolean contains(Map<String, ?> query) {
        return firstIndex(compiler.compile(query)) >= 0;
    }

    public boolean contains(ItemPredicate<? super T> predicate) {
        return firstIndex(predicate) >= 0;
    }

    private T firstMatch(ItemPredicate<? super T> predicate) {
        int index = firstIndex(predicate);
        return index < 0 ? null : items.get(index);
    }

    private int firstIndex(ItemPredicate<? super T> predicate) {
        for (int i = 0; i < items.size(); i++) {
            if (predicate.test(items.get(i), i)) {
                return i;
            }
        }
        return -1;
    }

    private T lastMatch(ItemPredicate<? super T> predicate) {
        for (int i = items.size() - 1; i >= 0; i--) {
            if (predicate.test(items.get(i), i)) {
                return items.get(i);
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // every / each
    // ------------------------------------------------------------------

    public boolean every(ItemPredicate<? super T> predicate) {
        return firstIndex(predicate.negate()) < 0;
    }

    public boolean every(Map<String, ?> query) {
        return every(compiler.<T>compile(query));
    }

    /** True when every item has a value (possibly null) at {@code key}. */
    public boolean every(String key) {
        return items.allSatisfy(item -> PathResolver.has(item, key));
    }

    public boolean every(String key, Object value) {
        return items.allSatisfy(item -> Values.equal(PathResolver.resolve(item, key), value));
    }

    public boolean every(String key, String operator, Object value) {
        return every(WhereOperator.toSpec(key, operator, value));
    }

    /**
     * Visits items in order until the callback returns {@code false}.
     */
    public ItemCollection<T> each(ItemPredicate<? super T> callback) {
        for (int i = 0; i < items.size(); i++) {
            if (!callback.test(items.get(i), i)) {
                break;
            }
        }
        return this;
    }

    // ------------------------------------------------------------------
    // Transformation
    // ------------------------------------------------------------------

    public <R> ItemCollection<R> map(ItemFunction<? super T, ? extends R> mapper) {
        MutableList<R> mapped = Lists.mutable.empty();
        items.forEachWithIndex((item, index) -> mapped.add(mapper.apply(item, index)));
        return derive(mapped);
    }

    /** Keeps the first item for each distinct value. */
    public ItemCollection<T> unique() {
        return unique(PathResolver.VALUE);
    }

    /** Keeps the first item for each distinct value at {@code key}. */
    public ItemCollection<T> unique(String key) {
        return unique(Aggregations.key(key));
    }

    public ItemCollection<T> unique(ItemFunction<? super T, ?> keyFn) {
        return derive(Aggregations.unique(items, keyFn));
    }

    /**
     * Splits into consecutive sub-collections of {@code size} items; the last may be shorter.
     */
    public ItemCollection<ItemCollection<T>> chunk(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + size);
        }
        MutableList<ItemCollection<T>> chunks = Lists.mutable.empty();
        for (int start = 0; start < items.size(); start += size) {
            chunks.add(derive(Lists.mutable.withAll(items.subList(start, Math.min(start + size, items.size())))));
        }
        return derive(chunks);
    }

    public ItemCollection<T> reverse() {
        return derive(items.toReversed());
    }

    public ItemCollection<T> slice(int start) {
        return slice(start, items.size());
    }

    /**
     * Items from {@code start} (inclusive) to {@code end} (exclusive); negative positions count
     * from the end.
     */
    public ItemCollection<T> slice(int start, int end) {
        int from = position(start);
        int to = Math.max(from, position(end));
        return derive(Lists.mutable.withAll(items.subList(from, to)));
    }

    public ItemCollection<T> concat(Iterable<? extends T> others) {
        MutableList<T> combined = Lists.mutable.withAll(items);
        others.forEach(combined::add);
        return derive(combined);
    }

    /** This collection followed by the items of {@code others} that it does not already contain. */
    public ItemCollection<T> union(Iterable<? extends T> others) {
        Set<Object> present = Sets.mutable.empty();
        items.forEach(item -> present.add(Values.normalize(item)));
        MutableList<T> combined = Lists.mutable.withAll(items);
        for (T other : others) {
            if (present.add(Values.normalize(other))) {
                combined.add(other);
            }
        }
        return derive(combined);
    }

    public ItemCollection<T> sortBy(String key) {
        return sortBy(Aggregations.key(key));
    }

    public ItemCollection<T> sortBy(ItemFunction<? super T, ?> keyFn) {
        return derive(sortedCopy(keyFn, false));
    }

    public ItemCollection<T> sortByDesc(String key) {
        return sortByDesc(Aggregations.key(key));
    }

    public ItemCollection<T> sortByDesc(ItemFunction<? super T, ?> keyFn) {
        return derive(sortedCopy(keyFn, true));
    }

    public Page<T> paginate(int page, int perPage) {
        if (page < 1 || perPage < 1) {
            throw new IllegalArgumentException("Page and page size must be positive, got " + page + ", " + perPage);
        }
        long from = (long) (page - 1) * perPage;
        int start = (int) Math.min(from, items.size());
        int end = (int) Math.min(from + perPage, items.size());
        Integer prev = page <= 1 ? null : page - 1;
        Integer next = items.size() > (long) page * perPage ? page + 1 : null;
        return new Page<>(derive(Lists.mutable.withAll(items.subList(start, end))), prev, next);
    }

    // ------------------------------------------------------------------
    // Aggregation
    // ------------------------------------------------------------------

    public Map<String, ItemCollection<T>> groupBy(String key) {
        return groupBy(Aggregations.key(key));
    }

    public Map<String, ItemCollection<T>> groupBy(ItemFunction<? super T, ?> keyFn) {
        Map<String, ItemCollection<T>> groups = new LinkedHashMap<>();
        Aggregations.groupBy(items, keyFn).forEach((key, bucket) -> groups.put(key, derive(bucket)));
        return groups;
    }

    public Map<String, Integer> countBy(String key) {
        return countBy(Aggregations.key(key));
    }

    public Map<String, Integer> countBy(ItemFunction<? super T, ?> keyFn) {
        return Aggregations.countBy(items, keyFn);
    }

    /** Maps each key to its item; when keys repeat, the later item wins. */
    public Map<String, T> keyBy(String key) {
        return keyBy(Aggregations.key(key));
    }

    public Map<String, T> keyBy(ItemFunction<? super T, ?> keyFn) {
        return Aggregations.keyBy(items, keyFn);
    }

    /** Returns (matching, non-matching). */
    public Pair<ItemCollection<T>, ItemCollection<T>> partition(Map<String, ?> query) {
        return partition(compiler.<T>compile(query));
    }

    public Pair<ItemCollection<T>, ItemCollection<T>> partition(ItemPredicate<? super T> predicate) {
        Pair<MutableList<T>, MutableList<T>> parts = Aggregations.partition(items, predicate);
        return Tuples.pair(derive(parts.getOne()), derive(parts.getTwo()));
    }

    public <A> A reduce(ItemReducer<A, ? super T> reducer, A initial) {
        return Aggregations.reduce(items, reducer, initial);
    }

    /** Sum of the items themselves; 0 when empty. */
    public double sum() {
        return sum(PathResolver.VALUE);
    }

    public double sum(String key) {
        return Aggregations.sum(items, Aggregations.key(key));
    }

    public double sum(ItemFunction<? super T, ?> valueFn) {
        return Aggregations.sum(items, valueFn);
    }

    /** Average of the items themselves, or {@code null} when there is no numeric item. */
    public Double avg() {
        return avg(PathResolver.VALUE);
    }

    public Double avg(String key) {
        return Aggregations.avg(items, Aggregations.key(key));
    }

    public Double avg(ItemFunction<? super T, ?> valueFn) {
        return Aggregations.avg(items, valueFn);
    }

    public Double min() {
        return min(PathResolver.VALUE);
    }

    public Double min(String key) {
        return Aggregations.min(items, Aggregations.key(key));
    }

    public Double min(ItemFunction<? super T, ?> valueFn) {
        return Aggregations.min(items, valueFn);
    }

    public Double max() {
        return max(PathResolver.VALUE);
    }

    public Double max(String key) {
        return Aggregations.max(items, Aggregations.key(key));
    }

    public Double max(ItemFunction<? super T, ?> valueFn) {
        return Aggregations.max(items, valueFn);
    }

    // ------------------------------------------------------------------
    // Mutation (in place, returns this)
    // ------------------------------------------------------------------

    /** Removes every item matching {@code query}. */
    public ItemCollection<T> delete(Map<String, ?> query) {
        return delete(compiler.<T>compile(query));
    }

    public ItemCollection<T> delete(ItemPredicate<? super T> predicate) {
        MutableList<T> kept = Lists.mutable.empty();
        items.forEachWithIndex((item, index) -> {
            if (!predicate.test(item, index)) {
                kept.add(item);
            }
        });
        LOGGER.debug("Deleted {} of {} items", items.size() - kept.size(), items.size());
        replaceAll(kept);
        return this;
    }

    /** Shallow-merges {@code patch} into every map item. */
    public ItemCollection<T> update(Map<String, ?> patch) {
        return update((ItemPredicate<T>) (item, index) -> true, patch);
    }

    public ItemCollection<T> update(Map<String, ?> query, Map<String, ?> patch) {
        return update(compiler.<T>compile(query), patch);
    }

    /**
     * Replaces each matching map item with a copy that has {@code patch} merged over it.
     *
     * @throws IllegalArgumentException if a matching item is not a map
     */
    public ItemCollection<T> update(ItemPredicate<? super T> predicate, Map<String, ?> patch) {
        return update(predicate, (item, index) -> merge(item, patch));
    }

    public ItemCollection<T> update(Map<String, ?> query, ItemFunction<? super T, ? extends T> replacement) {
        return update(compiler.<T>compile(query), replacement);
    }

    /** Replaces each matching item with what {@code replacement} returns for it. */
    public ItemCollection<T> update(ItemPredicate<? super T> predicate, ItemFunction<? super T, ? extends T> replacement) {
        int updated = 0;
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            if (predicate.test(item, i)) {
                items.set(i, replacement.apply(item, i));
                updated++;
            }
        }
        LOGGER.debug("Updated {} of {} items", updated, items.size());
        return this;
    }

    /** Removes the named fields, dot notation included, from every map item. */
    @SuppressWarnings("unchecked")
    public ItemCollection<T> forget(String... keys) {
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            for (String key : keys) {
                item = PathResolver.without(item, key);
            }
            items.set(i, (T) item);
        }
        return this;
    }

    /** Sorts the items themselves in ascending order. */
    public ItemCollection<T> sort() {
        return sort(PathResolver.VALUE, "asc");
    }

    public ItemCollection<T> sort(String key) {
        return sort(key, "asc");
    }

    /**
     * Stable in-place sort by the value at {@code key}. Missing values sort last in either
     * direction.
     *
     * @param direction {@code "asc"} or {@code "desc"}
     */
    public ItemCollection<T> sort(String key, String direction) {
        boolean descending = descending(direction);
        replaceAll(sortedCopy(Aggregations.key(key), descending));
        return this;
    }

    public ItemCollection<T> sort(Comparator<? super T> comparator) {
        items.sortThis(comparator);
        return this;
    }

    public ItemCollection<T> shuffle() {
        return shuffle(ThreadLocalRandom.current());
    }

    public ItemCollection<T> shuffle(Random random) {
        items.shuffleThis(random);
        return this;
    }

    @SafeVarargs
    public final ItemCollection<T> push(T... values) {
        items.addAll(Arrays.asList(values));
        return this;
    }

    @SafeVarargs
    public final ItemCollection<T> unshift(T... values) {
        items.addAll(0, Arrays.asList(values));
        return this;
    }

    /** Removes and returns the last item, or {@code null} when empty. */
    public T pop() {
        return items.isEmpty() ? null : items.remove(items.size() - 1);
    }

    /** Removes and returns the first item, or {@code null} when empty. */
    public T shift() {
        return items.isEmpty() ? null : items.remove(0);
    }

    /**
     * Removes {@code deleteCount} items starting at {@code start} (negative counts from the end),
     * inserts {@code inserts} in their place, and returns the removed items.
     */
    @SafeVarargs
    public final ItemCollection<T> splice(int start, int deleteCount, T... inserts) {
        int from = position(start);
        int to = Math.min(items.size(), from + Math.max(0, deleteCount));
        MutableList<T> removed = Lists.mutable.empty();
        for (int i = from; i < to; i++) {
            removed.add(items.remove(from));
        }
        items.addAll(from, Arrays.asList(inserts));
        return derive(removed);
    }

    // ------------------------------------------------------------------
    // Access and views
    // ------------------------------------------------------------------

    public int length() {
        return items.size();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isNotEmpty() {
        return items.notEmpty();
    }

    /** Item at {@code index}, negative counting from the end, or {@code null} when out of range. */
    public T get(int index) {
        int resolved = index < 0 ? items.size() + index : index;
        return resolved >= 0 && resolved < items.size() ? items.get(resolved) : null;
    }

    public T at(int index) {
        return get(index);
    }

    /** A uniformly random item, or {@code null} when empty. */
    public T random() {
        return items.isEmpty() ? null : items.get(ThreadLocalRandom.current().nextInt(items.size()));
    }

    /** Up to {@code count} distinct positions picked at random, in random order. */
    public ItemCollection<T> random(int count) {
        MutableList<T> shuffled = Lists.mutable.withAll(items).shuffleThis(ThreadLocalRandom.current());
        return derive(Lists.mutable.withAll(shuffled.subList(0, Math.max(0, Math.min(count, shuffled.size())))));
    }

    public String join(String key) {
        return join(key, ",");
    }

    public String join(String key, String separator) {
        return join(key, separator, separator);
    }

    /**
     * Joins the values at {@code key}, using {@code lastSeparator} between the last two.
     * <pre>{@code
     * names.join("name", ", ", " and ")   // "Ann, Bob and Cy"
     * }</pre>
     */
    public String join(String key, String separator, String lastSeparator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(i == items.size() - 1 ? lastSeparator : separator);
            }
            Object value = PathResolver.resolve(items.get(i), key);
            sb.append(value == null ? "" : Values.keyOf(value));
        }
        return sb.toString();
    }

    /** A copy of the items as a plain list. */
    public MutableList<T> toList() {
        return Lists.mutable.withAll(items);
    }

    public Object[] toArray() {
        return items.toArray();
    }

    public String toJson() {
        return COMPACT.format(items);
    }

    public String stringify() {
        return toJson();
    }

    public String stringify(boolean pretty) {
        return pretty ? PRETTY.format(items) : COMPACT.format(items);
    }

    /** Logs the items as JSON at INFO level. */
    public ItemCollection<T> dump() {
        LOGGER.info("{}", stringify(true));
        return this;
    }

    /**
     * Dumps, then stops the chain.
     *
     * @throws HaltException always
     */
    public ItemCollection<T> dd() {
        dump();
        throw new HaltException("dd() halted after dumping " + items.size() + " items");
    }

    // ------------------------------------------------------------------
    // Macros and branching
    // ------------------------------------------------------------------

    /**
     * Registers a macro on this collection. Collections derived from it afterwards see it too.
     *
     * @throws MacroCollisionException if {@code name} is a built-in method name
     */
    public ItemCollection<T> macro(String name, Macro macro) {
        macros.register(name, macro);
        return this;
    }

    /**
     * Invokes {@code name}: an instance macro first, then a shared macro, then the built-in method.
     *
     * @throws IllegalArgumentException if nothing is registered under {@code name}
     */
    public Object call(String name, Object... args) {
        Macro macro = macros.lookup(name);
        if (macro != null) {
            return macro.apply(this, args);
        }
        if (CollectionOperations.supports(name)) {
            return CollectionOperations.apply(this, name, args);
        }
        throw new IllegalArgumentException("No macro or collection method named '" + name + "'");
    }

    public MacroRegistry macros() {
        return macros;
    }

    public ValidatorMap validators() {
        return compiler.validators();
    }

    /** A copy with its own list, sharing macros and validators. */
    @Override
    public ItemCollection<T> clone() {
        return derive(Lists.mutable.withAll(items));
    }

    public ItemCollection<T> collect() {
        return clone();
    }

    /** A new collection of {@code others}, sharing this collection's macros and validators. */
    public <R> ItemCollection<R> collect(Iterable<? extends R> others) {
        return derive(copyOf(others));
    }

    @Override
    public Iterator<T> iterator() {
        return items.asUnmodifiable().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return items.equals(((ItemCollection<?>) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }

    // ------------------------------------------------------------------

    private <R> ItemCollection<R> derive(MutableList<R> derived) {
        return new ItemCollection<>(derived, compiler, macros);
    }

    private static <R> MutableList<R> copyOf(Iterable<? extends R> source) {
        MutableList<R> copy = Lists.mutable.empty();
        if (source != null) {
            source.forEach(copy::add);
        }
        return copy;
    }

    private void replaceAll(MutableList<T> replacement) {
        items.clear();
        items.addAll(replacement);
    }

    private int position(int index) {
        int resolved = index < 0 ? items.size() + index : index;
        return Math.max(0, Math.min(resolved, items.size()));
    }

    private MutableList<T> sortedCopy(ItemFunction<? super T, ?> keyFn, boolean descending) {
        MutableList<Pair<Object, T>> keyed = Lists.mutable.empty();
        for (int i = 0; i < items.size(); i++) {
            keyed.add(Tuples.<Object, T>pair(keyFn.apply(items.get(i), i), items.get(i)));
        }
        keyed.sortThis((a, b) -> compareKeys(a.getOne(), b.getOne(), descending));
        return keyed.collect(Pair::getTwo);
    }

    private static boolean descending(String direction) {
        if (direction == null || direction.equalsIgnoreCase("asc")) {
            return false;
        }
        if (direction.equalsIgnoreCase("desc")) {
            return true;
        }
        throw new IllegalArgumentException("Sort direction must be 'asc' or 'desc', got: " + direction);
    }

    // missing values last in both directions, then by kind, then by value
    private static int compareKeys(Object a, Object b, boolean descending) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        int result = Integer.compare(kind(a), kind(b));
        if (result == 0) {
            Integer compared = Values.compare(a, b);
            result = compared != null ? compared : a.toString().compareTo(b.toString());
        }
        return descending ? -result : result;
    }

    private static int kind(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof CharSequence) {
            return 1;
        }
        if (value instanceof Boolean) {
            return 2;
        }
        return 3;
    }

    @SuppressWarnings("unchecked")
    private static <T> T merge(T item, Map<String, ?> patch) {
        if (!(item instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Cannot merge a patch into a non-map item: " + item);
        }
        Map<Object, Object> merged = new LinkedHashMap<>(map);
        merged.putAll(patch);
        return (T) merged;
    }
}
