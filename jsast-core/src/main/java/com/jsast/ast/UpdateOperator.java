package com.jsast.ast;

/**
 * An update (increment or decrement) operator token.
 */
public enum UpdateOperator {
    INCREMENT("++"),
    DECREMENT("--");

    private final String value;

    UpdateOperator(String value) {
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
