package com.jsast;

/**
 * Thrown when a source position has a line below 1 or a column below 0.
 */
public class InvalidPositionException extends JsAstException {

    private final int line;
    private final int column;

    public InvalidPositionException(int line, int column) {
        super("L" + line + ":C" + column + " is not a valid ESTree position");
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
