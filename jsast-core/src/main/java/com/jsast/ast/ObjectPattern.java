package com.jsast.ast;

import java.util.List;
import java.util.Map;

public record ObjectPattern(
    SourceLocation loc,
    List<Node> properties
) implements Pattern {

    public ObjectPattern {
        properties = List.copyOf(properties);
    }

    @Override
    public String type() {
        return "ObjectPattern";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("properties", properties)
            .build();
    }
}
