package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * A block statement, i.e., a sequence of statements surrounded by braces.
 */
public record BlockStatement(
    SourceLocation loc,
    List<Statement> body
) implements Statement {

    public BlockStatement {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("body", body)
            .build();
    }
}
