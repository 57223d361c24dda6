package com.jsast.ast;

import java.util.Map;

/**
 * A unary operator expression. Every unary operator is a prefix operator.
 */
public sealed interface UnaryExpression extends Expression {

    UnaryOperator operator();

    Expression argument();

    default boolean prefix() {
        return true;
    }

    @Override
    default String type() {
        return "UnaryExpression";
    }

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("operator", operator())
            .put("prefix", prefix())
            .put("argument", argument())
            .build();
    }

    record UnaryMinusExpression(SourceLocation loc, Expression argument) implements UnaryExpression {
        @Override
        public UnaryOperator operator() {
            return UnaryOperator.MINUS;
        }
    }

    record UnaryPlusExpression(SourceLocation loc, Expression argument) implements UnaryExpression {
        @Override
        public UnaryOperator operator() {
            return UnaryOperator.PLUS;
        }
    }

    record UnaryLogicNotExpression(SourceLocation loc, Expression argument) implements UnaryExpression {
        @Override
        public UnaryOperator operator() {
            return UnaryOperator.NOT_LOGIC;
        }
    }

    record UnaryBitNotExpression(SourceLocation loc, Expression argument) implements UnaryExpression {
        @Override
        public UnaryOperator operator() {
            return UnaryOperator.NOT_BIT;
        }
    }

    record TypeofExpression(SourceLocation loc, Expression argument) implements UnaryExpression {
        @Override
        public UnaryOperator operator() {
            return UnaryOperator.TYPEOF;
        }
    }

    record VoidExpression(SourceLocation loc, Expression argument) implements UnaryExpression {
        @Override
        public UnaryOperator operator() {
            return UnaryOperator.VOID;
        }
    }

    record DeleteExpression(SourceLocation loc, Expression argument) implements UnaryExpression {
        @Override
        public UnaryOperator operator() {
            return UnaryOperator.DELETE;
        }
    }
}
