package com.jsast.ast;

import java.util.List;
import java.util.Map;

public record ImportDeclaration(
    SourceLocation loc,
    List<ModuleSpecifier> specifiers,
    Literal source
) implements ModuleDeclaration {

    public ImportDeclaration {
        specifiers = List.copyOf(specifiers);
    }

    @Override
    public String type() {
        return "ImportDeclaration";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("specifiers", specifiers)
            .put("source", source)
            .build();
    }
}
