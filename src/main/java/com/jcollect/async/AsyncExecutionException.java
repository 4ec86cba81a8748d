package com.jcollect.async;

/**
 * Wraps a checked exception raised by an executor when a deferred chain is awaited.
 */
public class AsyncExecutionException extends RuntimeException {
    public AsyncExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
