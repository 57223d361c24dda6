package com.jsast.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

/**
 * Superclass of the generated JavaScript lexer. Remembers the last token on the
 * default channel, which decides whether a {@code /} can start a regular expression
 * literal and whether {@code #!} sits at the start of the file.
 */
public abstract class JavaScriptLexerBase extends Lexer {

    private Token lastToken;

    public JavaScriptLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public Token nextToken() {
        Token next = super.nextToken();
        if (next.getChannel() == Token.DEFAULT_CHANNEL) {
            lastToken = next;
        }
        return next;
    }

    @Override
    public void reset() {
        lastToken = null;
        super.reset();
    }

    protected boolean isStartOfFile() {
        return lastToken == null;
    }

    /**
     * A regular expression literal can only appear where an expression may start,
     * never right after an operand.
     */
    protected boolean isRegexPossible() {
        if (lastToken == null) {
            return true;
        }
        switch (lastToken.getType()) {
            case JavaScriptLexer.Identifier:
            case JavaScriptLexer.NullLiteral:
            case JavaScriptLexer.BooleanLiteral:
            case JavaScriptLexer.This:
            case JavaScriptLexer.Super:
            case JavaScriptLexer.CloseBracket:
            case JavaScriptLexer.CloseParen:
            case JavaScriptLexer.DecimalLiteral:
            case JavaScriptLexer.HexIntegerLiteral:
            case JavaScriptLexer.OctalIntegerLiteral:
            case JavaScriptLexer.OctalIntegerLiteral2:
            case JavaScriptLexer.BinaryIntegerLiteral:
            case JavaScriptLexer.StringLiteral:
            case JavaScriptLexer.TemplateStringLiteral:
            case JavaScriptLexer.PlusPlus:
            case JavaScriptLexer.MinusMinus:
                return false;
            default:
                return true;
        }
    }
}
