package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * A comma-separated sequence of expressions.
 */
public record SequenceExpression(
    SourceLocation loc,
    List<Expression> expressions
) implements Expression {

    public SequenceExpression {
        expressions = List.copyOf(expressions);
    }

    @Override
    public String type() {
        return "SequenceExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("expressions", expressions)
            .build();
    }
}
