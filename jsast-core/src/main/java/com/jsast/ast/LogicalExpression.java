package com.jsast.ast;

import java.util.Map;

/**
 * A logical operator expression.
 */
public sealed interface LogicalExpression extends Expression {

    LogicalOperator operator();

    Expression left();

    Expression right();

    @Override
    default String type() {
        return "LogicalExpression";
    }

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("operator", operator())
            .put("left", left())
            .put("right", right())
            .build();
    }

    record OrLogicExpression(SourceLocation loc, Expression left, Expression right) implements LogicalExpression {
        @Override
        public LogicalOperator operator() {
            return LogicalOperator.OR;
        }
    }

    record AndLogicExpression(SourceLocation loc, Expression left, Expression right) implements LogicalExpression {
        @Override
        public LogicalOperator operator() {
            return LogicalOperator.AND;
        }
    }

    record NullishCoalescingLogicExpression(SourceLocation loc, Expression left, Expression right) implements LogicalExpression {
        @Override
        public LogicalOperator operator() {
            return LogicalOperator.NULLISH_COALESCING;
        }
    }
}
