package com.jsast.builder;

import com.jsast.UnsupportedFeatureException;
import com.jsast.ast.ArrayExpression;
import com.jsast.ast.AssignmentExpression;
import com.jsast.ast.BinaryExpression;
import com.jsast.ast.Expression;
import com.jsast.ast.Identifier;
import com.jsast.ast.LogicalExpression;
import com.jsast.ast.Pattern;
import com.jsast.ast.SequenceExpression;
import com.jsast.ast.SourceLocation;
import com.jsast.ast.Super;
import com.jsast.ast.ThisExpression;
import com.jsast.ast.UnaryExpression;
import com.jsast.ast.UpdateExpression;
import com.jsast.parser.JavaScriptParser;
import com.jsast.parser.JavaScriptParserBaseVisitor;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.RuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds expressions from {@code singleExpression} alternatives.
 *
 * <p>Operator productions that cover several tokens (additive, relational, compound
 * assignment and so on) resolve their node through an {@link OperatorTable}. Alternatives
 * without a translation fail with {@link UnsupportedFeatureException} named after the
 * production.</p>
 */
public class ExpressionBuilder extends JavaScriptParserBaseVisitor<Expression> {

    private static final Logger log = LoggerFactory.getLogger(ExpressionBuilder.class);

    @FunctionalInterface
    interface BinaryFactory {
        Expression create(SourceLocation loc, Expression left, Expression right);
    }

    @FunctionalInterface
    interface AssignmentFactory {
        Expression create(SourceLocation loc, Pattern left, Expression right);
    }

    private static final OperatorTable<JavaScriptParser.MultiplicativeExpressionContext, BinaryFactory> MULTIPLICATIVE =
        new OperatorTable<JavaScriptParser.MultiplicativeExpressionContext, BinaryFactory>("MultiplicativeExpression")
            .on(JavaScriptParser.MultiplicativeExpressionContext::Multiply, BinaryExpression.MulArithmeticExpression::new)
            .on(JavaScriptParser.MultiplicativeExpressionContext::Divide, BinaryExpression.DivArithmeticExpression::new)
            .on(JavaScriptParser.MultiplicativeExpressionContext::Modulus, BinaryExpression.ModArithmeticExpression::new);

    private static final OperatorTable<JavaScriptParser.AdditiveExpressionContext, BinaryFactory> ADDITIVE =
        new OperatorTable<JavaScriptParser.AdditiveExpressionContext, BinaryFactory>("AdditiveExpression")
            .on(JavaScriptParser.AdditiveExpressionContext::Plus, BinaryExpression.AddArithmeticExpression::new)
            .on(JavaScriptParser.AdditiveExpressionContext::Minus, BinaryExpression.SubArithmeticExpression::new);

    private static final OperatorTable<JavaScriptParser.BitShiftExpressionContext, BinaryFactory> BIT_SHIFT =
        new OperatorTable<JavaScriptParser.BitShiftExpressionContext, BinaryFactory>("BitShiftExpression")
            .on(JavaScriptParser.BitShiftExpressionContext::LeftShiftArithmetic, BinaryExpression.LeftBitShiftExpression::new)
            .on(JavaScriptParser.BitShiftExpressionContext::RightShiftArithmetic, BinaryExpression.RightBitShiftExpression::new)
            .on(JavaScriptParser.BitShiftExpressionContext::RightShiftLogical, BinaryExpression.LogicRightBitShiftExpression::new);

    private static final OperatorTable<JavaScriptParser.RelationalExpressionContext, BinaryFactory> RELATIONAL =
        new OperatorTable<JavaScriptParser.RelationalExpressionContext, BinaryFactory>("RelationalExpression")
            .on(JavaScriptParser.RelationalExpressionContext::LessThan, BinaryExpression.LowerThanRelationExpression::new)
            .on(JavaScriptParser.RelationalExpressionContext::MoreThan, BinaryExpression.GreaterThanRelationExpression::new)
            .on(JavaScriptParser.RelationalExpressionContext::LessThanEquals, BinaryExpression.LowerThanEqualRelationExpression::new)
            .on(JavaScriptParser.RelationalExpressionContext::GreaterThanEquals, BinaryExpression.GreaterThanEqualRelationExpression::new);

    private static final OperatorTable<JavaScriptParser.EqualityExpressionContext, BinaryFactory> EQUALITY =
        new OperatorTable<JavaScriptParser.EqualityExpressionContext, BinaryFactory>("EqualityExpression")
            .on(JavaScriptParser.EqualityExpressionContext::Equals_, BinaryExpression.EqualityExpression::new)
            .on(JavaScriptParser.EqualityExpressionContext::NotEquals, BinaryExpression.NotEqualityExpression::new)
            .on(JavaScriptParser.EqualityExpressionContext::IdentityEquals, BinaryExpression.IdentityEqualityExpression::new)
            .on(JavaScriptParser.EqualityExpressionContext::IdentityNotEquals, BinaryExpression.NotIdentityEqualityExpression::new);

    private static final OperatorTable<JavaScriptParser.AssignmentOperatorContext, AssignmentFactory> COMPOUND_ASSIGNMENT =
        new OperatorTable<JavaScriptParser.AssignmentOperatorContext, AssignmentFactory>("AssignmentOperator")
            .on(JavaScriptParser.AssignmentOperatorContext::MultiplyAssign, AssignmentExpression.MulAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::DivideAssign, AssignmentExpression.DivAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::ModulusAssign, AssignmentExpression.ModAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::PlusAssign, AssignmentExpression.AddAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::MinusAssign, AssignmentExpression.SubAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::LeftShiftArithmeticAssign, AssignmentExpression.ShlAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::RightShiftArithmeticAssign, AssignmentExpression.ShrAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::RightShiftLogicalAssign, AssignmentExpression.LogicShrAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::BitAndAssign, AssignmentExpression.AndAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::BitXorAssign, AssignmentExpression.XorAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::BitOrAssign, AssignmentExpression.OrAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::PowerAssign, AssignmentExpression.PowAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::AndAssign, AssignmentExpression.AndLogicAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::OrAssign, AssignmentExpression.OrLogicAssignExpression::new)
            .on(JavaScriptParser.AssignmentOperatorContext::NullishCoalescingAssign, AssignmentExpression.NullishCoalescingAssignExpression::new);

    private final String source;
    private final LiteralBuilder literals;
    private final ArrayElementsBuilder arrayElements;
    private final PatternBuilder patterns;

    public ExpressionBuilder(String source) {
        this.source = source;
        this.literals = new LiteralBuilder(source);
        this.arrayElements = new ArrayElementsBuilder(this, source);
        this.patterns = new PatternBuilder(this);
    }

    PatternBuilder patterns() {
        return patterns;
    }

    /**
     * Builds a comma-separated expression list. The result is a {@link SequenceExpression}
     * even when the list holds a single expression.
     */
    public SequenceExpression sequence(JavaScriptParser.ExpressionSequenceContext ctx) {
        List<Expression> expressions = new ArrayList<>();
        for (JavaScriptParser.SingleExpressionContext expression : ctx.singleExpression()) {
            expressions.add(visit(expression));
        }
        return new SequenceExpression(loc(ctx), expressions);
    }

    public Identifier identifier(JavaScriptParser.IdentifierContext ctx) {
        return new Identifier(loc(ctx), ctx.getText());
    }

    /**
     * Any alternative without a dedicated visit method is not translated yet.
     */
    @Override
    public Expression visitChildren(RuleNode node) {
        String production = Productions.name(node);
        log.debug("No expression translation for {}", production);
        throw new UnsupportedFeatureException(production);
    }

    // Leaves

    @Override
    public Expression visitThisExpression(JavaScriptParser.ThisExpressionContext ctx) {
        return new ThisExpression(loc(ctx));
    }

    @Override
    public Expression visitSuperExpression(JavaScriptParser.SuperExpressionContext ctx) {
        return new Super(loc(ctx));
    }

    @Override
    public Expression visitIdentifierExpression(JavaScriptParser.IdentifierExpressionContext ctx) {
        return identifier(ctx.identifier());
    }

    @Override
    public Expression visitLiteralExpression(JavaScriptParser.LiteralExpressionContext ctx) {
        return literals.visitLiteral(ctx.literal());
    }

    @Override
    public Expression visitArrayLiteralExpression(JavaScriptParser.ArrayLiteralExpressionContext ctx) {
        return arrayLiteral(ctx.arrayLiteral());
    }

    ArrayExpression arrayLiteral(JavaScriptParser.ArrayLiteralContext ctx) {
        return new ArrayExpression(loc(ctx), arrayElements.build(ctx.elementList()));
    }

    /**
     * {@code (a)} is {@code a}; {@code (a, b)} is a sequence.
     */
    @Override
    public Expression visitParenthesizedExpression(JavaScriptParser.ParenthesizedExpressionContext ctx) {
        JavaScriptParser.ExpressionSequenceContext sequence = ctx.expressionSequence();
        if (sequence.singleExpression().size() == 1) {
            return visit(sequence.singleExpression(0));
        }
        return sequence(sequence);
    }

    // Unary and update operators

    @Override
    public Expression visitUnaryMinusExpression(JavaScriptParser.UnaryMinusExpressionContext ctx) {
        return new UnaryExpression.UnaryMinusExpression(loc(ctx), visit(ctx.singleExpression()));
    }

    @Override
    public Expression visitUnaryPlusExpression(JavaScriptParser.UnaryPlusExpressionContext ctx) {
        return new UnaryExpression.UnaryPlusExpression(loc(ctx), visit(ctx.singleExpression()));
    }

    @Override
    public Expression visitNotExpression(JavaScriptParser.NotExpressionContext ctx) {
        return new UnaryExpression.UnaryLogicNotExpression(loc(ctx), visit(ctx.singleExpression()));
    }

    @Override
    public Expression visitBitNotExpression(JavaScriptParser.BitNotExpressionContext ctx) {
        return new UnaryExpression.UnaryBitNotExpression(loc(ctx), visit(ctx.singleExpression()));
    }

    @Override
    public Expression visitTypeofExpression(JavaScriptParser.TypeofExpressionContext ctx) {
        return new UnaryExpression.TypeofExpression(loc(ctx), visit(ctx.singleExpression()));
    }

    @Override
    public Expression visitVoidExpression(JavaScriptParser.VoidExpressionContext ctx) {
        return new UnaryExpression.VoidExpression(loc(ctx), visit(ctx.singleExpression()));
    }

    @Override
    public Expression visitDeleteExpression(JavaScriptParser.DeleteExpressionContext ctx) {
        return new UnaryExpression.DeleteExpression(loc(ctx), visit(ctx.singleExpression()));
    }

    @Override
    public Expression visitPreIncrementExpression(JavaScriptParser.PreIncrementExpressionContext ctx) {
        return new UpdateExpression.PreIncrementExpression(loc(ctx), updateTarget(ctx.singleExpression()));
    }

    @Override
    public Expression visitPreDecreaseExpression(JavaScriptParser.PreDecreaseExpressionContext ctx) {
        return new UpdateExpression.PreDecrementExpression(loc(ctx), updateTarget(ctx.singleExpression()));
    }

    @Override
    public Expression visitPostIncrementExpression(JavaScriptParser.PostIncrementExpressionContext ctx) {
        return new UpdateExpression.PostIncrementExpression(loc(ctx), updateTarget(ctx.singleExpression()));
    }

    @Override
    public Expression visitPostDecreaseExpression(JavaScriptParser.PostDecreaseExpressionContext ctx) {
        return new UpdateExpression.PostDecrementExpression(loc(ctx), updateTarget(ctx.singleExpression()));
    }

    // Binary operators

    @Override
    public Expression visitPowerExpression(JavaScriptParser.PowerExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), BinaryExpression.PowBinaryExpression::new);
    }

    @Override
    public Expression visitMultiplicativeExpression(JavaScriptParser.MultiplicativeExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), MULTIPLICATIVE.select(ctx));
    }

    @Override
    public Expression visitAdditiveExpression(JavaScriptParser.AdditiveExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), ADDITIVE.select(ctx));
    }

    @Override
    public Expression visitBitShiftExpression(JavaScriptParser.BitShiftExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), BIT_SHIFT.select(ctx));
    }

    @Override
    public Expression visitRelationalExpression(JavaScriptParser.RelationalExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), RELATIONAL.select(ctx));
    }

    @Override
    public Expression visitInstanceofExpression(JavaScriptParser.InstanceofExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), BinaryExpression.InstanceofExpression::new);
    }

    @Override
    public Expression visitInExpression(JavaScriptParser.InExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), BinaryExpression.InExpression::new);
    }

    @Override
    public Expression visitEqualityExpression(JavaScriptParser.EqualityExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), EQUALITY.select(ctx));
    }

    @Override
    public Expression visitBitAndExpression(JavaScriptParser.BitAndExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), BinaryExpression.AndBitExpression::new);
    }

    @Override
    public Expression visitBitXOrExpression(JavaScriptParser.BitXOrExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), BinaryExpression.XorBitExpression::new);
    }

    @Override
    public Expression visitBitOrExpression(JavaScriptParser.BitOrExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), BinaryExpression.OrBitExpression::new);
    }

    // Logical operators

    @Override
    public Expression visitLogicalAndExpression(JavaScriptParser.LogicalAndExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), LogicalExpression.AndLogicExpression::new);
    }

    @Override
    public Expression visitLogicalOrExpression(JavaScriptParser.LogicalOrExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), LogicalExpression.OrLogicExpression::new);
    }

    @Override
    public Expression visitCoalesceExpression(JavaScriptParser.CoalesceExpressionContext ctx) {
        return binary(ctx, ctx.singleExpression(), LogicalExpression.NullishCoalescingLogicExpression::new);
    }

    // Assignment

    @Override
    public Expression visitAssignmentExpression(JavaScriptParser.AssignmentExpressionContext ctx) {
        return assignment(ctx, ctx.singleExpression(), AssignmentExpression.SimpleAssignExpression::new);
    }

    @Override
    public Expression visitAssignmentOperatorExpression(JavaScriptParser.AssignmentOperatorExpressionContext ctx) {
        AssignmentFactory factory = COMPOUND_ASSIGNMENT.select(ctx.assignmentOperator());
        Pattern left = patterns.simpleTarget(visit(ctx.singleExpression(0)));
        Expression right = visit(ctx.singleExpression(1));
        return factory.create(loc(ctx), left, right);
    }

    // Named failures for alternatives that share a production with supported ones

    @Override
    public Expression visitFunctionExpression(JavaScriptParser.FunctionExpressionContext ctx) {
        if (ctx.anonymousFunction() instanceof JavaScriptParser.ArrowFunctionContext) {
            throw new UnsupportedFeatureException("ArrowFunctionExpression");
        }
        throw new UnsupportedFeatureException("FunctionExpression");
    }

    private Expression binary(ParserRuleContext ctx, List<JavaScriptParser.SingleExpressionContext> operands,
                              BinaryFactory factory) {
        Expression left = visit(operands.get(0));
        Expression right = visit(operands.get(1));
        return factory.create(loc(ctx), left, right);
    }

    private Expression assignment(ParserRuleContext ctx, List<JavaScriptParser.SingleExpressionContext> operands,
                                  AssignmentFactory factory) {
        JavaScriptParser.SingleExpressionContext target = operands.get(0);
        rejectObjectTargets(target);
        Pattern left = patterns.toPattern(visit(target));
        Expression right = visit(operands.get(1));
        return factory.create(loc(ctx), left, right);
    }

    private Expression updateTarget(JavaScriptParser.SingleExpressionContext operand) {
        Expression argument = visit(operand);
        patterns.simpleTarget(argument);
        return argument;
    }

    /**
     * Object patterns are not built; report them before their elements are read as expressions.
     */
    private static void rejectObjectTargets(JavaScriptParser.SingleExpressionContext target) {
        if (target instanceof JavaScriptParser.ObjectLiteralExpressionContext) {
            throw new UnsupportedFeatureException("ObjectLiteral assignment");
        }
        if (target instanceof JavaScriptParser.AssignmentExpressionContext assign) {
            rejectObjectTargets(assign.singleExpression(0));
        }
        if (target instanceof JavaScriptParser.ArrayLiteralExpressionContext array) {
            for (JavaScriptParser.ArrayElementContext element : array.arrayLiteral().elementList().arrayElement()) {
                rejectObjectTargets(element.singleExpression());
            }
        }
    }

    private SourceLocation loc(ParserRuleContext ctx) {
        return SourceLocations.of(ctx, source);
    }
}
