package com.jsast.ast;

import java.util.Map;

/**
 * An assignment operator expression. The target is always a pattern.
 */
public sealed interface AssignmentExpression extends Expression {

    AssignmentOperator operator();

    Pattern left();

    Expression right();

    @Override
    default String type() {
        return "AssignmentExpression";
    }

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("operator", operator())
            .put("left", left())
            .put("right", right())
            .build();
    }

    record SimpleAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.ASSIGN;
        }
    }

    record AddAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.ADD;
        }
    }

    record SubAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.SUB;
        }
    }

    record MulAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.MUL;
        }
    }

    record DivAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.DIV;
        }
    }

    record ModAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.MOD;
        }
    }

    record PowAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.POW;
        }
    }

    record ShlAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.SHL;
        }
    }

    record ShrAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.SHR;
        }
    }

    record LogicShrAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.SHR_LOGIC;
        }
    }

    record OrAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.OR;
        }
    }

    record XorAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.XOR;
        }
    }

    record AndAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.AND;
        }
    }

    record OrLogicAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.OR_LOGIC;
        }
    }

    record AndLogicAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.AND_LOGIC;
        }
    }

    record NullishCoalescingAssignExpression(SourceLocation loc, Pattern left, Expression right) implements AssignmentExpression {
        @Override
        public AssignmentOperator operator() {
            return AssignmentOperator.NULLISH_COALESCING;
        }
    }
}
