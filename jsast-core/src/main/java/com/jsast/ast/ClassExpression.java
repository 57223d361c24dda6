package com.jsast.ast;

public record ClassExpression(
    SourceLocation loc,
    Identifier id,
    Expression superClass,
    ClassBody body
) implements Expression, Class {

    @Override
    public String type() {
        return "ClassExpression";
    }
}
