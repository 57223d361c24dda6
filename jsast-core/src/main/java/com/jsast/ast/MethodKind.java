package com.jsast.ast;

public enum MethodKind {
    CONSTRUCTOR("constructor"),
    METHOD("method"),
    GET("get"),
    SET("set");

    private final String value;

    MethodKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
