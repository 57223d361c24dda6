package com.jsast.ast;

import java.util.Map;

/**
 * An update (increment or decrement) operator expression.
 */
public sealed interface UpdateExpression extends Expression {

    UpdateOperator operator();

    Expression argument();

    boolean prefix();

    @Override
    default String type() {
        return "UpdateExpression";
    }

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("operator", operator())
            .put("argument", argument())
            .put("prefix", prefix())
            .build();
    }

    record PreIncrementExpression(SourceLocation loc, Expression argument) implements UpdateExpression {
        @Override
        public UpdateOperator operator() {
            return UpdateOperator.INCREMENT;
        }

        @Override
        public boolean prefix() {
            return true;
        }
    }

    record PostIncrementExpression(SourceLocation loc, Expression argument) implements UpdateExpression {
        @Override
        public UpdateOperator operator() {
            return UpdateOperator.INCREMENT;
        }

        @Override
        public boolean prefix() {
            return false;
        }
    }

    record PreDecrementExpression(SourceLocation loc, Expression argument) implements UpdateExpression {
        @Override
        public UpdateOperator operator() {
            return UpdateOperator.DECREMENT;
        }

        @Override
        public boolean prefix() {
            return true;
        }
    }

    record PostDecrementExpression(SourceLocation loc, Expression argument) implements UpdateExpression {
        @Override
        public UpdateOperator operator() {
            return UpdateOperator.DECREMENT;
        }

        @Override
        public boolean prefix() {
            return false;
        }
    }
}
