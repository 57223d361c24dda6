package com.jsast.ast;

import java.util.Map;

/**
 * A property in an object expression or object pattern. In a pattern {@code value} is a
 * {@link Pattern}.
 */
public record Property(
    SourceLocation loc,
    Expression key,
    Node value,
    PropertyKind kind,
    boolean method,
    boolean shorthand,
    boolean computed
) implements Node {

    @Override
    public String type() {
        return "Property";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("key", key)
            .put("value", value)
            .put("kind", kind)
            .put("method", method)
            .put("shorthand", shorthand)
            .put("computed", computed)
            .build();
    }
}
