package com.jsast.ast;

import java.util.Map;

/**
 * A directive from the directive prologue of a script or function. {@code directive} is
 * the raw source of the directive without quotes.
 */
public record Directive(
    SourceLocation loc,
    Literal expression,
    String directive
) implements Statement {

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("expression", expression)
            .put("directive", directive)
            .build();
    }
}
