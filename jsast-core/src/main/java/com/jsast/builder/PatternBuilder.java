package com.jsast.builder;

import com.jsast.ParseException;
import com.jsast.UnsupportedFeatureException;
import com.jsast.ast.ArrayExpression;
import com.jsast.ast.ArrayPattern;
import com.jsast.ast.AssignmentExpression;
import com.jsast.ast.AssignmentPattern;
import com.jsast.ast.Identifier;
import com.jsast.ast.MemberExpression;
import com.jsast.ast.Node;
import com.jsast.ast.Pattern;
import com.jsast.ast.RestElement;
import com.jsast.ast.SourceLocation;
import com.jsast.ast.SpreadElement;
import com.jsast.parser.JavaScriptParser;
import com.jsast.parser.JavaScriptParserBaseVisitor;
import org.antlr.v4.runtime.tree.RuleNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds binding and assignment targets: the {@code assignable} production, and the
 * left-hand side of assignments, which the grammar parses as an expression.
 */
public class PatternBuilder extends JavaScriptParserBaseVisitor<Pattern> {

    private final ExpressionBuilder expressions;

    PatternBuilder(ExpressionBuilder expressions) {
        this.expressions = expressions;
    }

    @Override
    public Pattern visitAssignable(JavaScriptParser.AssignableContext ctx) {
        if (ctx.identifier() != null) {
            return expressions.identifier(ctx.identifier());
        }
        if (ctx.arrayLiteral() != null) {
            return toPattern(expressions.arrayLiteral(ctx.arrayLiteral()));
        }
        throw new UnsupportedFeatureException("ObjectLiteral assignment");
    }

    @Override
    public Pattern visitChildren(RuleNode node) {
        throw new UnsupportedFeatureException(Productions.name(node));
    }

    /**
     * Reinterprets an expression as an assignment target.
     *
     * @throws ParseException if the expression can never be assigned to
     */
    public Pattern toPattern(Node node) {
        if (node instanceof ArrayExpression array) {
            List<Node> source = array.elements();
            List<Pattern> elements = new ArrayList<>();
            for (int i = 0; i < source.size(); i++) {
                Node element = source.get(i);
                if (element instanceof SpreadElement spread) {
                    elements.add(restElement(spread, i == source.size() - 1));
                } else {
                    elements.add(element == null ? null : toPattern(element));
                }
            }
            return new ArrayPattern(array.loc(), elements);
        }
        if (node instanceof AssignmentExpression.SimpleAssignExpression assign) {
            return new AssignmentPattern(assign.loc(), assign.left(), assign.right());
        }
        return simpleTarget(node);
    }

    /**
     * Accepts only the targets a compound assignment or an update can write to.
     *
     * @throws ParseException for anything but an identifier or a member access
     */
    public Pattern simpleTarget(Node node) {
        if (node instanceof Identifier identifier) {
            return identifier;
        }
        if (node instanceof MemberExpression member) {
            return member;
        }
        throw invalid("Invalid assignment target " + node.type(), node);
    }

    private RestElement restElement(SpreadElement spread, boolean last) {
        if (!last) {
            throw invalid("Rest element must be last element", spread);
        }
        if (spread.argument() instanceof AssignmentExpression) {
            throw invalid("Rest element may not have a default initializer", spread);
        }
        return new RestElement(spread.loc(), toPattern(spread.argument()));
    }

    private static ParseException invalid(String message, Node node) {
        SourceLocation loc = node.loc();
        return new ParseException(message,
            loc == null ? 0 : loc.start().line(), loc == null ? 0 : loc.start().column());
    }
}
