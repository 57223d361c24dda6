package com.jsast.ast;

/**
 * An assignment operator token.
 */
public enum AssignmentOperator {
    ASSIGN("="),
    ADD("+="),
    SUB("-="),
    MUL("*="),
    DIV("/="),
    MOD("%="),
    POW("**="),
    SHL("<<="),
    SHR(">>="),
    SHR_LOGIC(">>>="),
    OR("|="),
    XOR("^="),
    AND("&="),
    OR_LOGIC("||="),
    AND_LOGIC("&&="),
    NULLISH_COALESCING("??=");

    private final String value;

    AssignmentOperator(String value) {
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
