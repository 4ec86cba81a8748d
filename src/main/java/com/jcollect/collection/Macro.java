package com.jcollect.collection;

/**
 * A user-registered method callable through {@link ItemCollection#call(String, Object...)}.
 * {@code self} is the collection the call was made on.
 */
@FunctionalInterface
public interface Macro {
    Object apply(ItemCollection<?> self, Object... args);
}
