package com.jsast.ast;

/**
 * Any statement.
 */
public sealed interface Statement extends Node permits
    EmptyStatement,
    BlockStatement,
    ExpressionStatement,
    Directive,
    ReturnStatement,
    BreakStatement,
    ContinueStatement,
    IfStatement,
    WhileStatement,
    DoWhileStatement,
    ForStatement,
    ForInStatement,
    Declaration,
    ModuleDeclaration {
}
