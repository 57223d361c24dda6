package com.jsast;

/**
 * Malformed input: a syntax error reported by the parser or a construct the
 * language itself forbids, such as assigning to a literal.
 */
public class ParseException extends JsAstException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, int line, int column, Throwable cause) {
        super(message + " at " + line + ":" + column, cause);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
