package com.jcollect.query;

/**
 * Built-in comparison operators of an operator clause. {@code $includes} is an alias of
 * {@code $contains}.
 */
public enum Operator {
    EQ("$eq"),
    GT("$gt"),
    GTE("$gte"),
    LT("$lt"),
    LTE("$lte"),
    IN("$in"),
    CONTAINS("$contains");

    /** Negation is structural (see {@link Clause.Not}) but its symbol is reserved here too. */
    public static final String NOT = "$not";

    private static final String INCLUDES = "$includes";

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns the operator for a {@code $}-prefixed symbol, or {@code null} when it is not built in.
     */
    public static Operator forSymbol(String symbol) {
        if (INCLUDES.equals(symbol)) {
            return CONTAINS;
        }
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }

    public static boolean isReserved(String symbol) {
        return NOT.equals(symbol) || forSymbol(symbol) != null;
    }
}
