package com.jsast.ast;

import java.util.List;
import java.util.Map;

public record ClassBody(
    SourceLocation loc,
    List<MethodDefinition> body
) implements Node {

    public ClassBody {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "ClassBody";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("body", body)
            .build();
    }
}
