package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * An object expression. Properties are {@link Property} or {@link SpreadElement} nodes.
 */
public record ObjectExpression(
    SourceLocation loc,
    List<Node> properties
) implements Expression {

    public ObjectExpression {
        properties = List.copyOf(properties);
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("properties", properties)
            .build();
    }
}
