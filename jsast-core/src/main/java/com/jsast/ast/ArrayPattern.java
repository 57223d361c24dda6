package com.jsast.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An array destructuring pattern. A {@code null} element is an elided position.
 */
public record ArrayPattern(
    SourceLocation loc,
    List<Pattern> elements
) implements Pattern {

    public ArrayPattern {
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public String type() {
        return "ArrayPattern";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("elements", elements)
            .build();
    }
}
