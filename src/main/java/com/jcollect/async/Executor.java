package com.jcollect.async;

import java.util.concurrent.CompletionStage;

/**
 * Interprets a recorded operation log against some backing store.
 *
 * @param <T> item type of the chain
 */
@FunctionalInterface
public interface Executor<T> {
    CompletionStage<?> execute(ExecutorContext<T> context) throws Exception;
}
