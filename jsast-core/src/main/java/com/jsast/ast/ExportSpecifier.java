package com.jsast.ast;

import java.util.Map;

public record ExportSpecifier(
    SourceLocation loc,
    Identifier local,
    Identifier exported
) implements ModuleSpecifier {

    @Override
    public String type() {
        return "ExportSpecifier";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("local", local)
            .put("exported", exported)
            .build();
    }
}
