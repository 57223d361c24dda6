package com.jsast.ast;

/**
 * Binding and assignment targets. {@link Identifier} and {@link MemberExpression}
 * are expressions and patterns at the same time.
 */
public sealed interface Pattern extends Node permits
    Identifier,
    MemberExpression,
    ObjectPattern,
    ArrayPattern,
    AssignmentPattern,
    RestElement {
}
