package com.jsast.ast;

import java.util.Map;

/**
 * An imported binding such as {@code {foo}} or {@code {foo as bar}} in an import
 * declaration.
 */
public record ImportSpecifier(
    SourceLocation loc,
    Identifier local,
    Identifier imported
) implements ModuleSpecifier {

    @Override
    public String type() {
        return "ImportSpecifier";
    }

    @Override
    public Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("local", local)
            .put("imported", imported)
            .build();
    }
}
