package com.jsast.builder;

import com.jsast.ParseException;
import com.jsast.ast.SourceLocation;

/**
 * Decodes the body of a quoted JavaScript string literal.
 */
final class StringLiterals {

    private static final int MAX_CODE_POINT = 0x10FFFF;

    private StringLiterals() {
    }

    /**
     * @param raw the literal including its surrounding quotes
     * @param loc where the literal starts, for error reporting
     * @return the string value with escape sequences and line continuations resolved
     * @throws ParseException if an escape sequence is malformed
     */
    static String unescape(String raw, SourceLocation loc) {
        String body = raw.substring(1, raw.length() - 1);
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            char e = body.charAt(i++);
            switch (e) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case '0' -> {
                    // legacy octal: \0 takes at most two more octal digits
                    int value = 0;
                    int end = Math.min(i + 2, body.length());
                    while (i < end && body.charAt(i) >= '0' && body.charAt(i) <= '7') {
                        value = value * 8 + (body.charAt(i++) - '0');
                    }
                    out.append((char) value);
                }
                case 'x' -> {
                    out.append((char) hex(body.substring(i, i + 2), 0xFF, loc));
                    i += 2;
                }
                case 'u' -> {
                    int codePoint;
                    if (body.charAt(i) == '{') {
                        int close = body.indexOf('}', i);
                        codePoint = hex(body.substring(i + 1, close), MAX_CODE_POINT, loc);
                        i = close + 1;
                    } else {
                        codePoint = hex(body.substring(i, i + 4), 0xFFFF, loc);
                        i += 4;
                    }
                    out.appendCodePoint(codePoint);
                }
                case '\r' -> {
                    // line continuation, \r\n counts as one terminator
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\n', '\u2028', '\u2029' -> {
                }
                default -> out.append(e);
            }
        }
        return out.toString();
    }

    private static int hex(String digits, int max, SourceLocation loc) {
        if (digits.isEmpty()) {
            throw malformed(digits, loc);
        }
        int value = 0;
        for (int i = 0; i < digits.length(); i++) {
            int digit = Character.digit(digits.charAt(i), 16);
            if (digit < 0) {
                throw malformed(digits, loc);
            }
            value = value * 16 + digit;
            if (value > max) {
                throw malformed(digits, loc);
            }
        }
        return value;
    }

    private static ParseException malformed(String digits, SourceLocation loc) {
        return new ParseException("Invalid escape sequence digits '" + digits + "'",
            loc.start().line(), loc.start().column());
    }
}
