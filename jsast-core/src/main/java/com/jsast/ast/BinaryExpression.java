package com.jsast.ast;

import java.util.Map;

/**
 * A binary operator expression. Each nested record binds exactly one {@link BinaryOperator}.
 */
public sealed interface BinaryExpression extends Expression {

    BinaryOperator operator();

    Expression left();

    Expression right();

    @Override
    default String type() {
        return "BinaryExpression";
    }

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("operator", operator())
            .put("left", left())
            .put("right", right())
            .build();
    }

    record EqualityExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.EQ;
        }
    }

    record NotEqualityExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.NEQ;
        }
    }

    record IdentityEqualityExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.EQ_IDENTITY;
        }
    }

    record NotIdentityEqualityExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.NEQ_IDENTITY;
        }
    }

    record LowerThanRelationExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.LT;
        }
    }

    record LowerThanEqualRelationExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.LTE;
        }
    }

    record GreaterThanRelationExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.GT;
        }
    }

    record GreaterThanEqualRelationExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.GTE;
        }
    }

    record LeftBitShiftExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.SHL;
        }
    }

    record RightBitShiftExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.SHR;
        }
    }

    record LogicRightBitShiftExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.SHR_LOGIC;
        }
    }

    record AddArithmeticExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.ADD;
        }
    }

    record SubArithmeticExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.SUB;
        }
    }

    record MulArithmeticExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.MUL;
        }
    }

    record DivArithmeticExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.DIV;
        }
    }

    record ModArithmeticExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.MOD;
        }
    }

    record OrBitExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.OR;
        }
    }

    record XorBitExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.XOR;
        }
    }

    record AndBitExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.AND;
        }
    }

    record InExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.IN;
        }
    }

    record InstanceofExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.INSTANCEOF;
        }
    }

    record PowBinaryExpression(SourceLocation loc, Expression left, Expression right) implements BinaryExpression {
        @Override
        public BinaryOperator operator() {
            return BinaryOperator.POW;
        }
    }
}
