package com.jsast.ast;

import java.util.Map;

public record BreakStatement(
    SourceLocation loc,
    Identifier label
) implements Statement {

    @Override
    public String type() {
        return "BreakStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("label", label)
            .build();
    }
}
