package com.jsast.ast;

import java.util.Map;

/**
 * A namespace import such as {@code * as foo}.
 */
public record ImportNamespaceSpecifier(
    SourceLocation loc,
    Identifier local
) implements ModuleSpecifier {

    @Override
    public String type() {
        return "ImportNamespaceSpecifier";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("local", local)
            .build();
    }
}
