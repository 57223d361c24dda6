package com.jsast.ast;

import java.util.Map;

/**
 * A dynamic import such as {@code import(source)}.
 */
public record ImportExpression(
    SourceLocation loc,
    Expression source
) implements Expression {

    @Override
    public String type() {
        return "ImportExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("source", source)
            .build();
    }
}
