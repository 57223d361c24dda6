package com.jsast.builder;

import com.jsast.ParseException;
import com.jsast.UnsupportedFeatureException;
import com.jsast.ast.Literal;
import com.jsast.ast.SourceLocation;
import com.jsast.parser.JavaScriptParser;
import com.jsast.parser.JavaScriptParserBaseVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Builds {@link Literal} nodes from {@code literal} productions.
 * Numbers are stored as doubles whatever their written radix.
 */
public class LiteralBuilder extends JavaScriptParserBaseVisitor<Literal> {

    private static final Logger log = LoggerFactory.getLogger(LiteralBuilder.class);

    private final String source;

    public LiteralBuilder(String source) {
        this.source = source;
    }

    @Override
    public Literal visitLiteral(JavaScriptParser.LiteralContext ctx) {
        log.debug("Literal: {}", ctx.getText());
        SourceLocation loc = SourceLocations.of(ctx, source);
        String raw = ctx.getText();

        if (ctx.NullLiteral() != null) {
            return new Literal.NullLiteral(loc, raw);
        }
        if (ctx.BooleanLiteral() != null) {
            return new Literal.BooleanLiteral(loc, "true".equals(raw), raw);
        }
        if (ctx.StringLiteral() != null) {
            return new Literal.StringLiteral(loc, StringLiterals.unescape(raw, loc), raw);
        }
        if (ctx.numericLiteral() != null) {
            return visitNumericLiteral(ctx.numericLiteral());
        }
        if (ctx.TemplateStringLiteral() != null) {
            throw new UnsupportedFeatureException("TemplateLiteral");
        }
        if (ctx.RegularExpressionLiteral() != null) {
            throw new UnsupportedFeatureException("RegExpLiteral");
        }
        if (ctx.bigintLiteral() != null) {
            throw new UnsupportedFeatureException("BigIntLiteral");
        }
        throw new IllegalStateException("Unknown literal alternative: " + raw);
    }

    @Override
    public Literal visitNumericLiteral(JavaScriptParser.NumericLiteralContext ctx) {
        String raw = ctx.getText();
        SourceLocation loc = SourceLocations.of(ctx, source);
        try {
            return new Literal.NumericLiteral(loc, parseNumber(ctx, raw, loc), raw);
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid numeric literal '" + raw + "'",
                loc.start().line(), loc.start().column(), e);
        }
    }

    private static double parseNumber(JavaScriptParser.NumericLiteralContext ctx, String raw, SourceLocation loc) {
        if (ctx.DecimalLiteral() != null) {
            return Double.parseDouble(digits(raw, 10, loc));
        }
        if (ctx.HexIntegerLiteral() != null) {
            return new BigInteger(digits(raw, 16, loc).substring(2), 16).doubleValue();
        }
        if (ctx.OctalIntegerLiteral2() != null) {
            return new BigInteger(digits(raw, 8, loc).substring(2), 8).doubleValue();
        }
        if (ctx.OctalIntegerLiteral() != null) {
            // legacy form: 017
            return new BigInteger(raw.substring(1), 8).doubleValue();
        }
        if (ctx.BinaryIntegerLiteral() != null) {
            return new BigInteger(digits(raw, 2, loc).substring(2), 2).doubleValue();
        }
        throw new IllegalStateException("Unknown numeric literal: " + raw);
    }

    /**
     * Strips numeric separators, each of which must sit between two digits of the radix.
     */
    private static String digits(String raw, int radix, SourceLocation loc) {
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == '_'
                && (i == 0 || i == raw.length() - 1
                    || Character.digit(raw.charAt(i - 1), radix) < 0
                    || Character.digit(raw.charAt(i + 1), radix) < 0)) {
                throw new ParseException("Misplaced numeric separator in '" + raw + "'",
                    loc.start().line(), loc.start().column());
            }
        }
        return raw.replace("_", "");
    }
}
