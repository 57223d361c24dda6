package com.jsast.ast;

import java.util.Map;

/**
 * A {@code for/in} statement. {@code left} is a {@link VariableDeclaration} or a {@link
 * Pattern}.
 */
public record ForInStatement(
    SourceLocation loc,
    Node left,
    Expression right,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "ForInStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("left", left)
            .put("right", right)
            .put("body", body)
            .build();
    }
}
