package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * A function or method call. {@code callee} may be {@link Super}.
 */
public record CallExpression(
    SourceLocation loc,
    Node callee,
    List<Node> arguments
) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("callee", callee)
            .put("arguments", arguments)
            .build();
    }
}
