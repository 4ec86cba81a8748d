package com.jcollect.query;

/**
 * A predicate over an item and its position in the collection.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface ItemPredicate<T> {
    boolean test(T item, int index);

    default ItemPredicate<T> negate() {
        return (item, index) -> !test(item, index);
    }
}
