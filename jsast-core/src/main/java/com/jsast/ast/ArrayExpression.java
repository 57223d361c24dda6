package com.jsast.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An array expression. Elements are expressions or {@link SpreadElement}s; a {@code null}
 * element is a hole, as in {@code [1,,2]}.
 */
public record ArrayExpression(
    SourceLocation loc,
    List<Node> elements
) implements Expression {

    public ArrayExpression {
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("elements", elements)
            .build();
    }
}
