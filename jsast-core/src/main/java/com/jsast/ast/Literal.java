package com.jsast.ast;

import java.math.BigInteger;
import java.util.Map;

/**
 * A literal token. Literals render as a single scalar value.
 */
public sealed interface Literal extends Expression, ScalarNode {

    Object value();

    /**
     * @return the literal as written in source, or {@code null} for synthesized nodes
     */
    String raw();

    @Override
    default String type() {
        return "Literal";
    }

    @Override
    default Map<String, Object> fields() {
        return NodeFields.of(this)
            .put("value", value())
            .put("raw", raw())
            .build();
    }

    record NullLiteral(SourceLocation loc, String raw) implements Literal {
        @Override
        public Object value() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record BooleanLiteral(SourceLocation loc, Boolean value, String raw) implements Literal {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    record StringLiteral(SourceLocation loc, String value, String raw) implements Literal {
        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    record NumericLiteral(SourceLocation loc, Double value, String raw) implements Literal {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * {@code bigint} holds the decimal digits of the value without the {@code n} suffix.
     */
    record BigIntLiteral(SourceLocation loc, BigInteger value, String raw, String bigint) implements Literal {
        @Override
        public Map<String, Object> fields() {
            return NodeFields.of(this)
                .put("value", value)
                .put("raw", raw)
                .put("bigint", bigint)
                .build();
        }

        @Override
        public String toString() {
            return bigint + "n";
        }
    }
}
