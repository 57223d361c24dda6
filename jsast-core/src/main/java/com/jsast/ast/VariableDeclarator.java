package com.jsast.ast;

import java.util.Map;

/**
 * A variable declarator. {@code init} is {@code null} when the declarator has no
 * initializer.
 */
public record VariableDeclarator(
    SourceLocation loc,
    Pattern id,
    Expression init
) implements Node {

    @Override
    public String type() {
        return "VariableDeclarator";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("id", id)
            .put("init", init)
            .build();
    }
}
