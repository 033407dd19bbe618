package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * A braced block.
 */
public class CompoundStmt extends Node {

    private final List<Node> statements;

    public CompoundStmt(SourceSpan span, List<Node> statements) {
        super(span);
        this.statements = List.copyOf(statements);
    }

    public List<Node> getStatements() {
        return statements;
    }

    @Override
    public List<Node> getChildren() {
        return statements;
    }
}
