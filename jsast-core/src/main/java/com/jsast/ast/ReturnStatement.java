package com.jsast.ast;

import java.util.Map;

public record ReturnStatement(
    SourceLocation loc,
    Expression argument
) implements Statement {

    @Override
    public String type() {
        return "ReturnStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("argument", argument)
            .build();
    }
}
