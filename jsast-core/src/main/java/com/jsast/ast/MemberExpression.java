package com.jsast.ast;

import java.util.Map;

/**
 * A member expression. When {@code computed} is true the node is {@code a[b]} and {@code
 * property} is any expression; otherwise it is {@code a.b} and {@code property} is an
 * {@link Identifier}. {@code object} is an expression or {@link Super}.
 */
public record MemberExpression(
    SourceLocation loc,
    Node object,
    Expression property,
    boolean computed
) implements Expression, Pattern {

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("object", object)
            .put("property", property)
            .put("computed", computed)
            .build();
    }
}
