package com.jsast.ast;

public enum PropertyKind {
    INIT("init"),
    GET("get"),
    SET("set");

    private final String value;

    PropertyKind(String value) {
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
