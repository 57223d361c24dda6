package com.jsast.ast;

import java.util.Map;

public record SpreadElement(
    SourceLocation loc,
    Expression argument
) implements Node {

    @Override
    public String type() {
        return "SpreadElement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("argument", argument)
            .build();
    }
}
