package com.jsast.ast;

/**
 * A module {@code import} or {@code export} declaration.
 */
public sealed interface ModuleDeclaration extends Statement permits
    ImportDeclaration,
    ExportNamedDeclaration,
    ExportDefaultDeclaration,
    ExportAllDeclaration {
}
