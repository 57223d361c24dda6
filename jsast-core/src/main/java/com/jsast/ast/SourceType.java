package com.jsast.ast;

public enum SourceType {
    SCRIPT("script"),
    MODULE("module");

    private final String value;

    SourceType(String value) {
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
