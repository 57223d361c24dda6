package com.jsast.ast;

/**
 * Any expression node.
 */
public sealed interface Expression extends Node permits
    ThisExpression,
    Super,
    ArrayExpression,
    ObjectExpression,
    FunctionExpression,
    ArrowFunctionExpression,
    ClassExpression,
    UnaryExpression,
    UpdateExpression,
    BinaryExpression,
    AssignmentExpression,
    LogicalExpression,
    MemberExpression,
    ConditionalExpression,
    CallExpression,
    NewExpression,
    SequenceExpression,
    MetaProperty,
    Identifier,
    Literal,
    ImportExpression {
}
