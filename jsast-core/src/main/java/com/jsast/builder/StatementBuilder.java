package com.jsast.builder;

import com.jsast.UnsupportedFeatureException;
import com.jsast.ast.BlockStatement;
import com.jsast.ast.EmptyStatement;
import com.jsast.ast.ExpressionStatement;
import com.jsast.ast.Statement;
import com.jsast.ast.VariableDeclaration;
import com.jsast.ast.VariableDeclarator;
import com.jsast.ast.VariableKind;
import com.jsast.parser.JavaScriptParser;
import com.jsast.parser.JavaScriptParserBaseVisitor;
import org.antlr.v4.runtime.tree.RuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds statements. Supported: empty, block, expression and variable statements.
 * Every other statement fails with {@link UnsupportedFeatureException}.
 *
 * <p>{@code inLoop} and {@code inFunction} describe the enclosing context and will
 * decide where {@code break}, {@code continue} and {@code return} are legal once those
 * statements are translated.</p>
 */
public class StatementBuilder extends JavaScriptParserBaseVisitor<Statement> {

    private static final Logger log = LoggerFactory.getLogger(StatementBuilder.class);

    private final boolean inLoop;
    private final boolean inFunction;
    private final String source;
    private final ExpressionBuilder expressions;
    private final VariableDeclaratorBuilder declarators;

    public StatementBuilder(boolean inLoop, boolean inFunction, String source) {
        this.inLoop = inLoop;
        this.inFunction = inFunction;
        this.source = source;
        this.expressions = new ExpressionBuilder(source);
        this.declarators = new VariableDeclaratorBuilder(expressions, source);
    }

    public boolean inLoop() {
        return inLoop;
    }

    public boolean inFunction() {
        return inFunction;
    }

    @Override
    public Statement visitStatement(JavaScriptParser.StatementContext ctx) {
        log.debug("Statement at {}:{}", ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine());
        return visit(ctx.getChild(0));
    }

    @Override
    public Statement visitEmptyStatement(JavaScriptParser.EmptyStatementContext ctx) {
        return new EmptyStatement(SourceLocations.of(ctx, source));
    }

    @Override
    public Statement visitBlock(JavaScriptParser.BlockContext ctx) {
        List<Statement> body = new ArrayList<>();
        if (ctx.statementList() != null) {
            for (JavaScriptParser.StatementContext statement : ctx.statementList().statement()) {
                body.add(visit(statement));
            }
        }
        return new BlockStatement(SourceLocations.of(ctx, source), body);
    }

    @Override
    public Statement visitExpressionStatement(JavaScriptParser.ExpressionStatementContext ctx) {
        return new ExpressionStatement(SourceLocations.of(ctx, source), expressions.sequence(ctx.expressionSequence()));
    }

    @Override
    public Statement visitVariableStatement(JavaScriptParser.VariableStatementContext ctx) {
        JavaScriptParser.VariableDeclarationListContext list = ctx.variableDeclarationList();
        VariableKind kind = VariableKind.fromKeyword(list.varModifier().getText());
        List<VariableDeclarator> declarations = new ArrayList<>();
        for (JavaScriptParser.VariableDeclarationContext declaration : list.variableDeclaration()) {
            declarations.add(declarators.build(declaration));
        }
        return new VariableDeclaration(SourceLocations.of(ctx, source), kind, declarations);
    }

    @Override
    public Statement visitDoStatement(JavaScriptParser.DoStatementContext ctx) {
        throw new UnsupportedFeatureException("DoWhileStatement");
    }

    @Override
    public Statement visitChildren(RuleNode node) {
        String production = Productions.name(node);
        log.debug("No statement translation for {}", production);
        throw new UnsupportedFeatureException(production);
    }
}
