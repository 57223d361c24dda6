package com.jsast.builder;

import com.jsast.ast.Expression;
import com.jsast.ast.Pattern;
import com.jsast.ast.VariableDeclarator;
import com.jsast.parser.JavaScriptParser;

/**
 * Builds one declarator of a {@code var}, {@code let} or {@code const} list.
 */
class VariableDeclaratorBuilder {

    private final ExpressionBuilder expressions;
    private final String source;

    VariableDeclaratorBuilder(ExpressionBuilder expressions, String source) {
        this.expressions = expressions;
        this.source = source;
    }

    VariableDeclarator build(JavaScriptParser.VariableDeclarationContext ctx) {
        Pattern id = expressions.patterns().visitAssignable(ctx.assignable());
        Expression init = ctx.singleExpression() == null ? null : expressions.visit(ctx.singleExpression());
        return new VariableDeclarator(SourceLocations.of(ctx, source), id, init);
    }
}
