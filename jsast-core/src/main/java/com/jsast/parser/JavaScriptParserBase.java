package com.jsast.parser;

import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;

/**
 * Superclass of the generated JavaScript parser: lookahead predicates and
 * the line-terminator checks behind automatic semicolon insertion.
 */
public abstract class JavaScriptParserBase extends Parser {

    public JavaScriptParserBase(TokenStream input) {
        super(input);
    }

    /**
     * @return true if the next token's text equals {@code text}
     */
    protected boolean n(String text) {
        return _input.LT(1).getText().equals(text);
    }

    protected boolean notLineTerminator() {
        return !lineTerminatorAhead();
    }

    protected boolean notOpenBraceAndNotFunction() {
        int nextTokenType = _input.LT(1).getType();
        return nextTokenType != JavaScriptParser.OpenBrace && nextTokenType != JavaScriptParser.Function_;
    }

    protected boolean closeBrace() {
        return _input.LT(1).getType() == JavaScriptParser.CloseBrace;
    }

    /**
     * Checks whether a line break sits between the previous significant token and the
     * current one: a hidden {@code LineTerminator}, possibly after whitespace, or a
     * multi-line comment spanning a line break.
     */
    protected boolean lineTerminatorAhead() {
        int index = getCurrentToken().getTokenIndex() - 1;
        if (index < 0) {
            return false;
        }
        Token ahead = _input.get(index);
        if (ahead.getChannel() != Lexer.HIDDEN) {
            return false;
        }
        if (ahead.getType() == JavaScriptParser.LineTerminator) {
            return true;
        }
        if (ahead.getType() == JavaScriptParser.WhiteSpaces) {
            index--;
            if (index < 0) {
                return false;
            }
            ahead = _input.get(index);
        }
        String text = ahead.getText();
        int type = ahead.getType();
        return (type == JavaScriptParser.MultiLineComment && (text.contains("\r") || text.contains("\n")))
            || type == JavaScriptParser.LineTerminator;
    }
}
