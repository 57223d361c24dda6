package com.jsast.ast;

/**
 * The {@code super} keyword used as a callee or member object.
 */
public record Super(SourceLocation loc) implements Expression {

    @Override
    public String type() {
        return "Super";
    }
}
