package com.jcollect.query;

import java.util.Collections;
import java.util.Map;

/**
 * Symbols accepted by the {@code where(key, operator, value)} shorthand and the operator each
 * one maps to. {@code !=} maps to {@code $not}, which negates an equality literal.
 */
public enum WhereOperator {
    EQUALS("=", "$eq"),
    NOT_EQUALS("!=", Operator.NOT),
    GREATER(">", "$gt"),
    LESS("<", "$lt"),
    GREATER_OR_EQUAL(">=", "$gte"),
    LESS_OR_EQUAL("<=", "$lte"),
    IN("in", "$in"),
    INCLUDES("includes", "$includes");

    private final String symbol;
    private final String operator;

    WhereOperator(String symbol, String operator) {
        this.symbol = symbol;
        this.operator = operator;
    }

    public String symbol() {
        return symbol;
    }

    public String operator() {
        return operator;
    }

    /**
     * @throws QueryCompilationException for an unknown symbol
     */
    public static WhereOperator fromSymbol(String symbol) {
        for (WhereOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new QueryCompilationException("Unexpected where operator: " + symbol
                + " (expected one of = != > < >= <= in includes)");
    }

    /** {@code where(key, value)} as a query specification. */
    public static Map<String, Object> toSpec(String key, Object value) {
        return EQUALS.query(key, value);
    }

    /** {@code where(key, symbol, value)} as a query specification. */
    public static Map<String, Object> toSpec(String key, String symbol, Object value) {
        return fromSymbol(symbol).query(key, value);
    }

    /** A single-field query applying this operator to {@code value}. */
    public Map<String, Object> query(String key, Object value) {
        if (key == null) {
            throw new QueryCompilationException("where() requires a key");
        }
        return Collections.singletonMap(key, Collections.singletonMap(operator, value));
    }
}
