package com.jcollect.query;

import com.jcollect.path.PathResolver;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Compiles query specifications into item predicates.
 * <p>
 * A specification is either an {@link ItemPredicate}, used as-is, or a map of field path to
 * clause. Clauses are literals (equality, or a regex find for a {@link Pattern}) or operator maps
 * such as {@code {"$gte": 18, "$lt": 65}}. A top-level {@code "$not"} negates a nested
 * specification against the whole item. Compilation is eager: malformed specifications fail here,
 * never while iterating.
 */
public class QueryCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCompiler.class);

    private final ValidatorMap validators;
    private final QueryMatcher matcher = new QueryMatcher();

    public QueryCompiler() {
        this(ValidatorMap.empty());
    }

    public QueryCompiler(ValidatorMap validators) {
        this.validators = validators == null ? ValidatorMap.empty() : validators;
    }

    public ValidatorMap validators() {
        return validators;
    }

    @SuppressWarnings("unchecked")
    public <T> ItemPredicate<T> compile(Object spec) {
        if (spec instanceof ItemPredicate<?> predicate) {
            return (ItemPredicate<T>) predicate;
        }
        if (spec instanceof Map<?, ?> map) {
            QueryNode node = parse(map);
            LOGGER.debug("Compiled query {} into {}", spec, node);
            return (item, index) -> matcher.matches(node, item);
        }
        throw new QueryCompilationException("Query must be a map or an ItemPredicate, got: "
                + (spec == null ? "null" : spec.getClass().getName()));
    }

    public QueryNode parse(Map<?, ?> spec) {
        MutableList<QueryNode> nodes = Lists.mutable.empty();
        for (Map.Entry<?, ?> entry : spec.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (key.equals(Operator.NOT)) {
                if (!(entry.getValue() instanceof Map<?, ?> nested)) {
                    throw new QueryCompilationException("Top-level $not requires a nested query, got: "
                            + entry.getValue());
                }
                nodes.add(new QueryNode.Not(parse(nested)));
            } else if (key.startsWith("$") && !key.equals(PathResolver.VALUE)) {
                throw new QueryCompilationException("Unknown top-level operator " + key
                        + " (operators belong inside a field's operator object)");
            } else {
                nodes.add(new QueryNode.FieldMatch(key, parseClause(key, entry.getValue())));
            }
        }
        if (nodes.isEmpty()) {
            return new QueryNode.Always();
        }
        return nodes.size() == 1 ? nodes.getFirst() : new QueryNode.And(nodes.toImmutable().castToList());
    }

    private Clause parseClause(String path, Object raw) {
        if (raw instanceof Pattern pattern) {
            return new Clause.Matches(pattern);
        }
        if (!isOperatorMap(raw)) {
            return new Clause.Comparison(Operator.EQ, raw);
        }
        Map<?, ?> operators = (Map<?, ?>) raw;
        MutableList<Clause> clauses = Lists.mutable.empty();
        for (Map.Entry<?, ?> entry : operators.entrySet()) {
            String symbol = String.valueOf(entry.getKey());
            if (!symbol.startsWith("$")) {
                throw new QueryCompilationException("Operator object for '" + path
                        + "' mixes operators with plain key '" + symbol + "'");
            }
            clauses.add(parseOperator(path, symbol, entry.getValue()));
        }
        return clauses.size() == 1 ? clauses.getFirst() : new Clause.AllOf(clauses.toImmutable().castToList());
    }

    private Clause parseOperator(String path, String symbol, Object operand) {
        if (symbol.equals(Operator.NOT)) {
            return new Clause.Not(parseClause(path, operand));
        }
        Operator operator = Operator.forSymbol(symbol);
        if (operator == Operator.IN) {
            if (!Values.isSequence(operand)) {
                throw new QueryCompilationException("$in on '" + path + "' requires a collection or array, got: "
                        + operand);
            }
            return new Clause.Comparison(operator, Values.elements(operand));
        }
        if (operator != null) {
            return new Clause.Comparison(operator, operand);
        }
        Validator validator = validators.get(symbol);
        if (validator != null) {
            return new Clause.Custom(symbol, validator.create(path, operand));
        }
        throw new QueryCompilationException("Unknown operator " + symbol + " on '" + path + "'");
    }

    private static boolean isOperatorMap(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return false;
        }
        for (Object key : map.keySet()) {
            if (String.valueOf(key).startsWith("$")) {
                return true;
            }
        }
        return false;
    }
}
