package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * A complete program source tree.
 */
public record Program(
    SourceLocation loc,
    SourceType sourceType,
    List<Statement> body
) implements Node {

    public Program {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("sourceType", sourceType)
            .put("body", body)
            .build();
    }
}
