package com.jsast.ast;

/**
 * A binary operator token.
 */
public enum BinaryOperator {
    EQ("=="),
    NEQ("!="),
    EQ_IDENTITY("==="),
    NEQ_IDENTITY("!=="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    SHL("<<"),
    SHR(">>"),
    SHR_LOGIC(">>>"),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    OR("|"),
    XOR("^"),
    AND("&"),
    IN("in"),
    INSTANCEOF("instanceof"),
    POW("**");

    private final String value;

    BinaryOperator(String value) {
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
