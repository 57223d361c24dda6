package com.jsast.ast;

/**
 * A logical operator token.
 */
public enum LogicalOperator {
    OR("||"),
    AND("&&"),
    NULLISH_COALESCING("??");

    private final String value;

    LogicalOperator(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
