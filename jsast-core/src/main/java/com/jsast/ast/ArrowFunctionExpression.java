package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * A fat arrow function expression, e.g., {@code (bar) => { ... }}. Arrow functions
 * have no id. {@code body} is a {@link FunctionBody} or, when {@code expression}
 * is true, an {@link Expression}.
 */
public record ArrowFunctionExpression(
    SourceLocation loc,
    List<Pattern> params,
    Node body,
    boolean expression
) implements Expression, Function {

    public ArrowFunctionExpression {
        params = List.copyOf(params);
    }

    @Override
    public Identifier id() {
        return null;
    }

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("id", null)
            .put("params", params)
            .put("body", body)
            .put("expression", expression)
            .build();
    }
}
