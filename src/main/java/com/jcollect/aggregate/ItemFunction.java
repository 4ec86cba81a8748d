package com.jcollect.aggregate;

/**
 * A function of an item and its position in the collection.
 *
 * @param <T> item type
 * @param <R> result type
 */
@FunctionalInterface
public interface ItemFunction<T, R> {
    R apply(T item, int index);
}
