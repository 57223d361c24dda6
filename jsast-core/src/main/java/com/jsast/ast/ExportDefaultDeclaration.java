package com.jsast.ast;

import java.util.Map;

/**
 * An export default declaration. {@code declaration} is a function or class declaration
 * (with a {@code null} id when anonymous) or an expression.
 */
public record ExportDefaultDeclaration(
    SourceLocation loc,
    Node declaration
) implements ModuleDeclaration {

    @Override
    public String type() {
        return "ExportDefaultDeclaration";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("declaration", declaration)
            .build();
    }
}
