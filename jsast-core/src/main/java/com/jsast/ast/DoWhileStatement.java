package com.jsast.ast;

import java.util.Map;

public record DoWhileStatement(
    SourceLocation loc,
    Statement body,
    Expression test
) implements Statement {

    @Override
    public String type() {
        return "DoWhileStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("body", body)
            .put("test", test)
            .build();
    }
}
