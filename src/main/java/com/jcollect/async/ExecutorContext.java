package com.jcollect.async;

import com.jcollect.query.ValidatorMap;
import org.eclipse.collections.api.list.ImmutableList;

import java.time.Instant;
import java.util.Objects;

/**
 * What an {@link Executor} receives when a deferred chain is run.
 *
 * @param operations the operation log in chain order
 * @param validators custom operators of the chain, never null
 * @param metadata   when and how the context was built
 * @param <T>        item type of the chain
 */
public record ExecutorContext<T>(ImmutableList<Operation> operations, ValidatorMap validators, Metadata metadata) {
    public ExecutorContext {
        Objects.requireNonNull(operations, "operations");
        Objects.requireNonNull(metadata, "metadata");
        validators = validators == null ? ValidatorMap.empty() : validators;
    }

    /**
     * @param createdAt      when the context was built, at execution time
     * @param operationCount number of recorded operations
     * @param chainDepth     number of chain calls that produced the log
     */
    public record Metadata(Instant createdAt, int operationCount, int chainDepth) {
    }

    static <T> ExecutorContext<T> forLog(ImmutableList<Operation> operations, ValidatorMap validators) {
        return new ExecutorContext<>(operations, validators,
                new Metadata(Instant.now(), operations.size(), operations.size()));
    }
}
