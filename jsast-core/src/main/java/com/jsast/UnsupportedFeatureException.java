package com.jsast;

/**
 * Thrown when a builder meets a valid JavaScript construct that it does not translate yet.
 * This is not a syntax error: the source is fine, the AST conversion is incomplete.
 */
public class UnsupportedFeatureException extends JsAstException {

    private final String feature;

    public UnsupportedFeatureException(String feature) {
        super("Unsupported feature: " + feature);
        this.feature = feature;
    }

    /**
     * @return the name of the grammar production that could not be converted
     */
    public String feature() {
        return feature;
    }
}
