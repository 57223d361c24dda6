package com.jsast.ast;

import java.util.Map;

public record MethodDefinition(
    SourceLocation loc,
    Expression key,
    FunctionExpression value,
    MethodKind kind,
    boolean computed,
    boolean isStatic
) implements Node {

    @Override
    public String type() {
        return "MethodDefinition";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("key", key)
            .put("value", value)
            .put("kind", kind)
            .put("computed", computed)
            .put("static", isStatic)
            .build();
    }
}
