package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * An export named declaration such as {@code export {foo, bar};} or {@code export var foo
 * = 1;}. A non-null {@code declaration} together with specifiers or a source is invalid.
 */
public record ExportNamedDeclaration(
    SourceLocation loc,
    Declaration declaration,
    List<ExportSpecifier> specifiers,
    Literal source
) implements ModuleDeclaration {

    public ExportNamedDeclaration {
        specifiers = List.copyOf(specifiers);
    }

    @Override
    public String type() {
        return "ExportNamedDeclaration";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("declaration", declaration)
            .put("specifiers", specifiers)
            .put("source", source)
            .build();
    }
}
