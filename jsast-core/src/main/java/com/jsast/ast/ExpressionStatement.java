package com.jsast.ast;

import java.util.Map;

/**
 * An expression statement, i.e., a statement consisting of a single expression.
 */
public record ExpressionStatement(
    SourceLocation loc,
    Expression expression
) implements Statement {

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("expression", expression)
            .build();
    }
}
