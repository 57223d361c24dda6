package com.jsast.ast;

import java.util.Map;

/**
 * An export batch declaration such as {@code export * as foo from "mod";}.
 */
public record ExportAllDeclaration(
    SourceLocation loc,
    Literal source,
    Identifier exported
) implements ModuleDeclaration {

    @Override
    public String type() {
        return "ExportAllDeclaration";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("source", source)
            .put("exported", exported)
            .build();
    }
}
