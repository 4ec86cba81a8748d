package com.jcollect.async;

import com.jcollect.collection.CollectionOperations;
import com.jcollect.collection.ItemCollection;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Replays an operation log against an in-memory {@link ItemCollection} built from a source.
 * Resolves to a list when the last operation leaves a collection, to the scalar otherwise.
 *
 * @param <T> item type
 */
public class InMemoryExecutor<T> implements Executor<T> {
    private final MutableList<T> source;

    public InMemoryExecutor(Iterable<? extends T> source) {
        this.source = Lists.mutable.withAll(source);
    }

    @Override
    public CompletionStage<?> execute(ExecutorContext<T> context) {
        Object current = new ItemCollection<>(source, context.validators());
        for (Operation operation : context.operations()) {
            if (!(current instanceof ItemCollection<?> collection)) {
                throw new IllegalStateException("Cannot apply " + operation.method()
                        + " to a non-collection result: " + current);
            }
            current = CollectionOperations.apply(collection, operation.method(), operation.argsArray());
        }
        if (current instanceof ItemCollection<?> collection) {
            return CompletableFuture.completedFuture(collection.toList());
        }
        return CompletableFuture.completedFuture(current);
    }
}
