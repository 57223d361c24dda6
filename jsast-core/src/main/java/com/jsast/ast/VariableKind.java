package com.jsast.ast;

public enum VariableKind {
    VAR("var"),
    LET("let"),
    CONST("const");

    private final String value;

    VariableKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Maps a declaration keyword to its kind.
     *
     * @throws IllegalArgumentException if the keyword is not {@code var}, {@code let} or {@code const}
     */
    public static VariableKind fromKeyword(String keyword) {
        for (VariableKind kind : values()) {
            if (kind.value.equals(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown variable kind: " + keyword);
    }

    @Override
    public String toString() {
        return value;
    }
}
