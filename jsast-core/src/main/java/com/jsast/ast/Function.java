package com.jsast.ast;

import java.util.List;
import java.util.Map;

/**
 * Common shape of function declarations and expressions.
 */
public sealed interface Function extends Node permits
    FunctionDeclaration,
    FunctionExpression,
    ArrowFunctionExpression {

    Identifier id();

    List<Pattern> params();

    Node body();

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("id", id())
            .put("params", params())
            .put("body", body())
            .build();
    }
}
