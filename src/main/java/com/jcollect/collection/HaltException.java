package com.jcollect.collection;

/**
 * Thrown by {@link ItemCollection#dd()} after dumping, to stop the calling chain.
 */
public class HaltException extends RuntimeException {
    public HaltException(String message) {
        super(message);
    }
}
