package com.jsast.ast;

import java.util.Map;

/**
 * A pattern with a default value, as in {@code [a = 1] = b}.
 */
public record AssignmentPattern(
    SourceLocation loc,
    Pattern left,
    Expression right
) implements Pattern {

    @Override
    public String type() {
        return "AssignmentPattern";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("left", left)
            .put("right", right)
            .build();
    }
}
