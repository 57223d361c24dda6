package com.jsast.ast;

import java.util.List;

/**
 * A function declaration. {@code id} is {@code null} only for an anonymous
 * function in {@code export default function () {}}.
 */
public record FunctionDeclaration(
    SourceLocation loc,
    Identifier id,
    List<Pattern> params,
    FunctionBody body
) implements Declaration, Function {

    public FunctionDeclaration {
        params = List.copyOf(params);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
