package com.jsast.ast;

import java.util.Map;

/**
 * A {@code for} statement. {@code init} is a {@link VariableDeclaration}, an {@link
 * Expression} or {@code null}.
 */
public record ForStatement(
    SourceLocation loc,
    Node init,
    Expression test,
    Expression update,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "ForStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("init", init)
            .put("test", test)
            .put("update", update)
            .put("body", body)
            .build();
    }
}
