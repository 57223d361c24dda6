package com.jsast.ast;

import java.util.List;
import java.util.Map;

public record VariableDeclaration(
    SourceLocation loc,
    VariableKind kind,
    List<VariableDeclarator> declarations
) implements Declaration {

    public VariableDeclaration {
        declarations = List.copyOf(declarations);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("kind", kind)
            .put("declarations", declarations)
            .build();
    }
}
