package com.jcollect.aggregate;

@FunctionalInterface
public interface ItemReducer<A, T> {
    A apply(A accumulator, T item, int index);
}
