package com.jsast.builder;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the operator token present in a production to the factory of the matching node.
 * Candidates are tested in registration order and exactly one must be present.
 *
 * @param <C> the production type
 * @param <F> the node factory type
 */
final class OperatorTable<C extends ParserRuleContext, F> {

    interface TokenAccessor<C> {
        TerminalNode token(C ctx);
    }

    private record Candidate<C, F>(TokenAccessor<C> accessor, F factory) {
    }

    private final String production;
    private final List<Candidate<C, F>> candidates = new ArrayList<>();

    OperatorTable(String production) {
        this.production = production;
    }

    OperatorTable<C, F> on(TokenAccessor<C> accessor, F factory) {
        candidates.add(new Candidate<>(accessor, factory));
        return this;
    }

    /**
     * @throws IllegalStateException if no candidate or more than one candidate token is present
     */
    F select(C ctx) {
        F selected = null;
        for (Candidate<C, F> candidate : candidates) {
            if (candidate.accessor().token(ctx) == null) {
                continue;
            }
            if (selected != null) {
                throw new IllegalStateException("Several operator tokens in " + production + ": " + ctx.getText());
            }
            selected = candidate.factory();
        }
        if (selected == null) {
            throw new IllegalStateException("No known operator token in " + production + ": " + ctx.getText());
        }
        return selected;
    }
}
