package com.jsast.ast;

/**
 * Any declaration node. Declarations are also statements.
 */
public sealed interface Declaration extends Statement permits
    FunctionDeclaration,
    VariableDeclaration,
    ClassDeclaration {
}
