package com.jsast.ast;

import java.util.Map;

/**
 * Base interface for all ESTree AST nodes.
 *
 * <p>{@link #type()} is the ESTree variant tag. {@link #fields()} starts with
 * {@code type} and {@code loc} and continues with the variant's own fields in
 * declaration order; generic consumers such as the tree printer rely on that order.</p>
 */
public sealed interface Node extends FieldContainer permits
    Program,
    Statement,
    Expression,
    Pattern,
    Function,
    Class,
    ModuleSpecifier,
    Property,
    VariableDeclarator,
    ClassBody,
    MethodDefinition,
    SpreadElement,
    FunctionBody {

    String type();

    SourceLocation loc();

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this).build();
    }
}
