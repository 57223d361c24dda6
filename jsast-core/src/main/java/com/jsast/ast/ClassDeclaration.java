package com.jsast.ast;

/**
 * A class declaration. {@code id} is {@code null} only in {@code export default class {}}.
 */
public record ClassDeclaration(
    SourceLocation loc,
    Identifier id,
    Expression superClass,
    ClassBody body
) implements Declaration, Class {

    @Override
    public String type() {
        return "ClassDeclaration";
    }
}
