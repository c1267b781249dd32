package com.tessera.query.predicate;

public enum LogicalOperator {
    AND,
    OR,
    NOT
}
