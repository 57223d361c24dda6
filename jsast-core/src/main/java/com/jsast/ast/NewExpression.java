package com.jsast.ast;

import java.util.List;
import java.util.Map;

public record NewExpression(
    SourceLocation loc,
    Expression callee,
    List<Node> arguments
) implements Expression {

    public NewExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "NewExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("callee", callee)
            .put("arguments", arguments)
            .build();
    }
}
