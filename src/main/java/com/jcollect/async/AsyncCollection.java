package com.jcollect.async;

import com.jcollect.aggregate.ItemFunction;
import com.jcollect.collection.Macro;
import com.jcollect.query.ItemPredicate;
import com.jcollect.query.ValidatorMap;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * A deferred collection chain. Every chain method returns a new instance whose operation log is
 * the receiver's plus one entry; nothing is evaluated until {@link #run()} (or one of the
 * awaiting methods) hands the finished log to the {@link Executor}.
 * <pre>{@code
 * AsyncCollection<User> base = new AsyncCollection<>(executor);
 * Object active = base.where("status", "active").sortBy("name").await();
 * }</pre>
 * An instance runs its executor at most once. The settled outcome, value or failure, is kept and
 * handed to every later caller.
 *
 * @param <T> item type
 */
public class AsyncCollection<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncCollection.class);

    private final Executor<T> executor;
    private final ValidatorMap validators;
    private final ImmutableList<Operation> operations;

    private CompletableFuture<Object> result;

    public AsyncCollection(Executor<T> executor) {
        this(executor, ValidatorMap.empty());
    }

    public AsyncCollection(Executor<T> executor, ValidatorMap validators) {
        this(executor, validators, Lists.immutable.empty());
    }

    private AsyncCollection(Executor<T> executor, ValidatorMap validators, ImmutableList<Operation> operations) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.validators = validators == null ? ValidatorMap.empty() : validators;
        this.operations = operations;
    }

    public ImmutableList<Operation> operations() {
        return operations;
    }

    public ValidatorMap validators() {
        return validators;
    }

    // ------------------------------------------------------------------
    // Chain methods
    // ------------------------------------------------------------------

    public AsyncCollection<T> where(String key, Object value) {
        return append("where", key, value);
    }

    public AsyncCollection<T> where(String key, String operator, Object value) {
        return append("where", key, operator, value);
    }

    public AsyncCollection<T> whereNot(String key, Object value) {
        return append("whereNot", key, value);
    }

    public AsyncCollection<T> whereNot(String key, String operator, Object value) {
        return append("whereNot", key, operator, value);
    }

    public AsyncCollection<T> filter(Map<String, ?> query) {
        return append("filter", query);
    }

    public AsyncCollection<T> filter(ItemPredicate<? super T> predicate) {
        return append("filter", predicate);
    }

    public AsyncCollection<T> not(Map<String, ?> query) {
        return append("not", query);
    }

    public AsyncCollection<T> not(ItemPredicate<? super T> predicate) {
        return append("not", predicate);
    }

    public AsyncCollection<T> first() {
        return append("first");
    }

    public AsyncCollection<T> first(Map<String, ?> query) {
        return append("first", query);
    }

    public AsyncCollection<T> first(ItemPredicate<? super T> predicate) {
        return append("first", predicate);
    }

    public AsyncCollection<T> last() {
        return append("last");
    }

    public AsyncCollection<T> last(Map<String, ?> query) {
        return append("last", query);
    }

    public AsyncCollection<T> last(ItemPredicate<? super T> predicate) {
        return append("last", predicate);
    }

    public AsyncCollection<T> find(Map<String, ?> query) {
        return append("find", query);
    }

    public AsyncCollection<T> find(ItemPredicate<? super T> predicate) {
        return append("find", predicate);
    }

    public AsyncCollection<T> sort() {
        return append("sort");
    }

    public AsyncCollection<T> sort(String key) {
        return append("sort", key);
    }

    public AsyncCollection<T> sort(String key, String direction) {
        return append("sort", key, direction);
    }

    public AsyncCollection<T> sort(Comparator<? super T> comparator) {
        return append("sort", comparator);
    }

    public AsyncCollection<T> sortBy(String key) {
        return append("sortBy", key);
    }

    public AsyncCollection<T> sortBy(ItemFunction<? super T, ?> fn) {
        return append("sortBy", fn);
    }

    public AsyncCollection<T> sortByDesc(String key) {
        return append("sortByDesc", key);
    }

    public AsyncCollection<T> sortByDesc(ItemFunction<? super T, ?> fn) {
        return append("sortByDesc", fn);
    }

    public AsyncCollection<T> reverse() {
        return append("reverse");
    }

    public AsyncCollection<T> shuffle() {
        return append("shuffle");
    }

    public AsyncCollection<T> slice(int start) {
        return append("slice", start);
    }

    public AsyncCollection<T> slice(int start, int end) {
        return append("slice", start, end);
    }

    public AsyncCollection<T> chunk(int size) {
        return append("chunk", size);
    }

    public AsyncCollection<T> paginate() {
        return append("paginate");
    }

    public AsyncCollection<T> paginate(int page) {
        return append("paginate", page);
    }

    public AsyncCollection<T> paginate(int page, int perPage) {
        return append("paginate", page, perPage);
    }

    public AsyncCollection<T> sum() {
        return append("sum");
    }

    public AsyncCollection<T> sum(String key) {
        return append("sum", key);
    }

    public AsyncCollection<T> sum(ItemFunction<? super T, ?> fn) {
        return append("sum", fn);
    }

    public AsyncCollection<T> avg() {
        return append("avg");
    }

    public AsyncCollection<T> avg(String key) {
        return append("avg", key);
    }

    public AsyncCollection<T> avg(ItemFunction<? super T, ?> fn) {
        return append("avg", fn);
    }

    public AsyncCollection<T> max() {
        return append("max");
    }

    public AsyncCollection<T> max(String key) {
        return append("max", key);
    }

    public AsyncCollection<T> max(ItemFunction<? super T, ?> fn) {
        return append("max", fn);
    }

    public AsyncCollection<T> min() {
        return append("min");
    }

    public AsyncCollection<T> min(String key) {
        return append("min", key);
    }

    public AsyncCollection<T> min(ItemFunction<? super T, ?> fn) {
        return append("min", fn);
    }

    public AsyncCollection<T> groupBy(String key) {
        return append("groupBy", key);
    }

    public AsyncCollection<T> groupBy(ItemFunction<? super T, ?> fn) {
        return append("groupBy", fn);
    }

    public AsyncCollection<T> countBy(String key) {
        return append("countBy", key);
    }

    public AsyncCollection<T> countBy(ItemFunction<? super T, ?> fn) {
        return append("countBy", fn);
    }

    public AsyncCollection<T> unique() {
        return append("unique");
    }

    public AsyncCollection<T> unique(String key) {
        return append("unique", key);
    }

    public AsyncCollection<T> unique(ItemFunction<? super T, ?> fn) {
        return append("unique", fn);
    }

    public AsyncCollection<T> random() {
        return append("random");
    }

    public AsyncCollection<T> random(int count) {
        return append("random", count);
    }

    public AsyncCollection<T> every(String key) {
        return append("every", key);
    }

    public AsyncCollection<T> every(String key, Object value) {
        return append("every", key, value);
    }

    public AsyncCollection<T> every(String key, String operator, Object value) {
        return append("every", key, operator, value);
    }

    public AsyncCollection<T> every(Map<String, ?> query) {
        return append("every", query);
    }

    public AsyncCollection<T> every(ItemPredicate<? super T> predicate) {
        return append("every", predicate);
    }

    @SuppressWarnings("unchecked")
    public <R> AsyncCollection<R> map(ItemFunction<? super T, ? extends R> mapper) {
        return new AsyncCollection<>((Executor<R>) (Executor<?>) executor, validators,
                operations.newWith(Operation.of("map", mapper)));
    }

    public AsyncCollection<T> each(ItemPredicate<? super T> callback) {
        return append("each", callback);
    }

    public AsyncCollection<T> forget(String... keys) {
        return append("forget", (Object[]) keys);
    }

    public AsyncCollection<T> update(Map<String, ?> patch) {
        return append("update", patch);
    }

    public AsyncCollection<T> update(Map<String, ?> query, Map<String, ?> patch) {
        return append("update", query, patch);
    }

    public AsyncCollection<T> delete(Map<String, ?> query) {
        return append("delete", query);
    }

    public AsyncCollection<T> delete(ItemPredicate<? super T> predicate) {
        return append("delete", predicate);
    }

    public AsyncCollection<T> macro(String name, Macro macro) {
        return append("macro", name, macro);
    }

    public AsyncCollection<T> collect() {
        return append("collect");
    }

    /** Starts over from {@code items}, discarding the result so far. */
    public AsyncCollection<T> collect(Iterable<? extends T> items) {
        return append("collect", items);
    }

    public AsyncCollection<T> dump() {
        return append("dump");
    }

    public AsyncCollection<T> dd() {
        return append("dd");
    }

    public AsyncCollection<T> stringify() {
        return append("stringify");
    }

    public AsyncCollection<T> stringify(boolean pretty) {
        return append("stringify", pretty);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Runs the executor on the first call and returns a view of the settled result on every call.
     * A synchronous throw from the executor settles the result exceptionally. Completing the
     * returned future does not change what later callers see.
     */
    public CompletableFuture<Object> run() {
        return settled().copy();
    }

    public <R> CompletableFuture<R> then(Function<Object, ? extends R> onFulfilled) {
        return settled().thenApply(onFulfilled);
    }

    public CompletableFuture<Object> exceptionally(Function<Throwable, ?> onRejected) {
        return settled().exceptionally(error -> onRejected.apply(unwrap(error)));
    }

    /**
     * Waits for the result.
     *
     * @throws CompletionException if the executor failed
     */
    public Object join() {
        return settled().join();
    }

    /**
     * Waits for the result, rethrowing the executor's own unchecked failure.
     *
     * @throws AsyncExecutionException if the executor failed with a checked exception
     */
    public Object await() {
        try {
            return settled().join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AsyncExecutionException("Deferred chain failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public String toString() {
        return "AsyncCollection" + operations;
    }

    private AsyncCollection<T> append(String method, Object... args) {
        return new AsyncCollection<>(executor, validators, operations.newWith(Operation.of(method, args)));
    }

    private synchronized CompletableFuture<Object> settled() {
        if (result == null) {
            ExecutorContext<T> context = ExecutorContext.forLog(operations, validators);
            LOGGER.debug("Executing deferred chain with {} operations: {}", operations.size(), operations);
            result = execute(context);
        }
        return result;
    }

    private CompletableFuture<Object> execute(ExecutorContext<T> context) {
        CompletionStage<?> stage;
        try {
            stage = executor.execute(context);
        } catch (Throwable t) {
            LOGGER.debug("Executor failed synchronously", t);
            return CompletableFuture.failedFuture(t);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(null);
        }
        return stage.toCompletableFuture().thenApply(value -> (Object) value);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
