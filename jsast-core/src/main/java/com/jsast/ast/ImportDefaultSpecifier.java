package com.jsast.ast;

import java.util.Map;

public record ImportDefaultSpecifier(
    SourceLocation loc,
    Identifier local
) implements ModuleSpecifier {

    @Override
    public String type() {
        return "ImportDefaultSpecifier";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("local", local)
            .build();
    }
}
