package com.jsast.builder;

import com.jsast.ast.Expression;
import com.jsast.ast.Node;
import com.jsast.ast.SpreadElement;
import com.jsast.parser.JavaScriptParser;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands an {@code elementList} into array elements. Shared by array literals and
 * array destructuring targets.
 */
class ArrayElementsBuilder {

    private final ExpressionBuilder expressions;
    private final String source;

    ArrayElementsBuilder(ExpressionBuilder expressions, String source) {
        this.expressions = expressions;
        this.source = source;
    }

    /**
     * A comma met while an element is expected marks a hole, which becomes a
     * {@code null} element: {@code [1,,2]} has three elements, {@code [1,]} has one.
     */
    List<Node> build(JavaScriptParser.ElementListContext ctx) {
        List<Node> elements = new ArrayList<>();
        if (ctx.children == null) {
            return elements;
        }
        boolean expectElement = true;
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode) {
                if (expectElement) {
                    elements.add(null);
                }
                expectElement = true;
            } else {
                elements.add(element((JavaScriptParser.ArrayElementContext) child));
                expectElement = false;
            }
        }
        return elements;
    }

    private Node element(JavaScriptParser.ArrayElementContext ctx) {
        Expression expression = expressions.visit(ctx.singleExpression());
        if (ctx.Ellipsis() != null) {
            return new SpreadElement(SourceLocations.of(ctx, source), expression);
        }
        return expression;
    }
}
