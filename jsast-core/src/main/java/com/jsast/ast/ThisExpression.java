package com.jsast.ast;

public record ThisExpression(SourceLocation loc) implements Expression {

    @Override
    public String type() {
        return "ThisExpression";
    }
}
