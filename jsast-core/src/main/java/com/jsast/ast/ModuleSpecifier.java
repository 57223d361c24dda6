package com.jsast.ast;

/**
 * A specifier in an import or export declaration.
 */
public sealed interface ModuleSpecifier extends Node permits
    ImportSpecifier,
    ImportDefaultSpecifier,
    ImportNamespaceSpecifier,
    ExportSpecifier {

    Identifier local();
}
