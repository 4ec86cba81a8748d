package com.jcollect.query;

/**
 * Thrown at the call site when a query specification cannot be compiled.
 */
public class QueryCompilationException extends IllegalArgumentException {
    public QueryCompilationException(String message) {
        super(message);
    }
}
