package com.jsast.ast;

import java.util.Map;

public record WhileStatement(
    SourceLocation loc,
    Expression test,
    Statement body
) implements Statement {

    @Override
    public String type() {
        return "WhileStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("test", test)
            .put("body", body)
            .build();
    }
}
