package com.jsast;

/**
 * Thrown when a builder's result is read before the builder has been run.
 */
public class MissingResultException extends JsAstException {

    public MissingResultException(String message) {
        super(message);
    }
}
