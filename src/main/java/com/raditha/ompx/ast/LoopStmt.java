package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

/**
 * Common base of {@code for}, {@code while} and {@code do} loops.
 */
public abstract class LoopStmt extends Node {

    private final Node body;

    protected LoopStmt(SourceSpan span, Node body) {
        super(span);
        this.body = body;
    }

    public Node getBody() {
        return body;
    }
}
