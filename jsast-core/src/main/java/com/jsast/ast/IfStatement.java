package com.jsast.ast;

import java.util.Map;

public record IfStatement(
    SourceLocation loc,
    Expression test,
    Statement consequent,
    Statement alternate
) implements Statement {

    @Override
    public String type() {
        return "IfStatement";
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
