package com.jsast.ast;

import java.util.Map;

/**
 * Common shape of class declarations and expressions.
 */
public sealed interface Class extends Node permits
    ClassDeclaration,
    ClassExpression {

    Identifier id();

    Expression superClass();

    ClassBody body();

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("id", id())
            .put("superClass", superClass())
            .put("body", body())
            .build();
    }
}
