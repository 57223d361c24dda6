package com.jsast.ast;

import java.util.Map;

/**
 * A ternary {@code ?:} expression.
 */
public record ConditionalExpression(
    SourceLocation loc,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {

    @Override
    public String type() {
        return "ConditionalExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("test", test)
            .put("consequent", consequent)
            .put("alternate", alternate)
            .build();
    }
}
