package com.jsast.builder;

import com.jsast.ast.SourceLocation;
import com.jsast.ast.SourceLocation.Position;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/**
 * Computes node locations from parse-tree token ranges.
 */
final class SourceLocations {

    private SourceLocations() {
    }

    /**
     * Start is the first token's position. End is one past the last character of the
     * last token, or the EOF position when the production ends at EOF. Empty
     * productions collapse to their start.
     */
    static SourceLocation of(ParserRuleContext ctx, String source) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        Position startPosition = startOf(start);
        if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            return new SourceLocation(source, startPosition, startPosition);
        }
        return new SourceLocation(source, startPosition, endOf(stop));
    }

    static SourceLocation of(Token token, String source) {
        return new SourceLocation(source, startOf(token), endOf(token));
    }

    private static Position startOf(Token token) {
        return new Position(token.getLine(), token.getCharPositionInLine());
    }

    static Position endOf(Token token) {
        if (token.getType() == Token.EOF) {
            return startOf(token);
        }
        String text = token.getText();
        int line = token.getLine();
        int column = token.getCharPositionInLine();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                continue;
            }
            if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        return new Position(line, column);
    }
}
