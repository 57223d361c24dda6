package com.jsast.ast;

import java.util.Map;

/**
 * A meta property such as {@code new.target} or {@code import.meta}.
 */
public record MetaProperty(
    SourceLocation loc,
    Identifier meta,
    Identifier property
) implements Expression {

    @Override
    public String type() {
        return "MetaProperty";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("meta", meta)
            .put("property", property)
            .build();
    }
}
