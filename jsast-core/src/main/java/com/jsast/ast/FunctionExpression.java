package com.jsast.ast;

import java.util.List;

public record FunctionExpression(
    SourceLocation loc,
    Identifier id,
    List<Pattern> params,
    FunctionBody body
) implements Expression, Function {

    public FunctionExpression {
        params = List.copyOf(params);
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }
}
