package com.jcollect.collection;

/**
 * One page of a collection. {@code prev} and {@code next} are the neighbouring page numbers, or
 * {@code null} at either end.
 */
public record Page<T>(ItemCollection<T> items, Integer prev, Integer next) {}
