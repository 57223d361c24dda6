package com.jsast;

/**
 * Thrown by the tree printer when asked to render below nesting level 0.
 */
public class InvalidNestingLevelException extends JsAstException {

    public InvalidNestingLevelException(int nestingLevel) {
        super("Nesting level can't be below 0, got " + nestingLevel);
    }
}
