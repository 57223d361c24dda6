package com.jsast.ast;

import java.util.Map;

public record Identifier(
    SourceLocation loc,
    String name
) implements Expression, Pattern {

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("name", name)
            .build();
    }
}
