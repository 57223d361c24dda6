package com.jsast.ast;

/**
 * An empty statement, i.e., a solitary semicolon.
 */
public record EmptyStatement(SourceLocation loc) implements Statement {

    @Override
    public String type() {
        return "EmptyStatement";
    }
}
