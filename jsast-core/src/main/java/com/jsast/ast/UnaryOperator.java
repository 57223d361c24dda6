package com.jsast.ast;

/**
 * A unary operator token.
 */
public enum UnaryOperator {
    MINUS("-"),
    PLUS("+"),
    NOT_LOGIC("!"),
    NOT_BIT("~"),
    TYPEOF("typeof"),
    VOID("void"),
    DELETE("delete");

    private final String value;

    UnaryOperator(String value) {
        this.value = value;
    }

    /**
     * @return the operator as written in source
     */
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
