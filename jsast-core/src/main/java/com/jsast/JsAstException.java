package com.jsast;

/**
 * Base class for every error raised while building or rendering an AST.
 */
public class JsAstException extends RuntimeException {

    public JsAstException(String message) {
        super(message);
    }

    public JsAstException(String message, Throwable cause) {
        super(message, cause);
    }
}
