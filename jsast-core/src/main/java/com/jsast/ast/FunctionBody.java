package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * The body of a function: a block statement that may begin with directives.
 */
public record FunctionBody(
    SourceLocation loc,
    List<Statement> body
) implements Node {

    public FunctionBody {
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
