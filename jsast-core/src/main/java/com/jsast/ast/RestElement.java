package com.jsast.ast;

import java.util.Map;

public record RestElement(
    SourceLocation loc,
    Pattern argument
) implements Pattern {

    @Override
    public String type() {
        return "RestElement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("argument", argument)
            .build();
    }
}
