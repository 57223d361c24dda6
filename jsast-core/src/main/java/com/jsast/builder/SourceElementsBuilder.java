package com.jsast.builder;

import com.jsast.ast.Statement;
import com.jsast.parser.JavaScriptParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the top-level statement list of a program, in source order.
 */
class SourceElementsBuilder {

    private final StatementBuilder statements;

    SourceElementsBuilder(String source) {
        this.statements = new StatementBuilder(false, false, source);
    }

    /**
     * @param ctx the source elements, or {@code null} for an empty program
     */
    List<Statement> build(JavaScriptParser.SourceElementsContext ctx) {
        List<Statement> body = new ArrayList<>();
        if (ctx == null) {
            return body;
        }
        for (JavaScriptParser.SourceElementContext element : ctx.sourceElement()) {
            body.add(statements.visit(element.statement()));
        }
        return body;
    }
}
