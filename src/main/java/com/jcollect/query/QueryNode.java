package com.jcollect.query;

import java.util.List;

public sealed interface QueryNode {
    record Always() implements QueryNode {}
    record FieldMatch(String path, Clause clause) implements QueryNode {}
    record And(List<QueryNode> nodes) implements QueryNode {}
    record Not(QueryNode node) implements QueryNode {}  // top-level $not, negated against the whole item
}
