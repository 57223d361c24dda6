package com.jsast.json;

import com.jsast.JsAstException;

/**
 * A node could not be written as JSON.
 */
public class AstJsonException extends JsAstException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
