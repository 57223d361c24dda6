package com.jsast.builder;

import org.antlr.v4.runtime.tree.RuleNode;

final class Productions {

    private static final String CONTEXT_SUFFIX = "Context";

    private Productions() {
    }

    /**
     * @return the grammar production (or labelled alternative) a parse-tree node was built for,
     *     e.g. {@code IfStatement} for an {@code IfStatementContext}
     */
    static String name(RuleNode node) {
        String name = node.getClass().getSimpleName();
        if (name.endsWith(CONTEXT_SUFFIX)) {
            return name.substring(0, name.length() - CONTEXT_SUFFIX.length());
        }
        return name;
    }
}
