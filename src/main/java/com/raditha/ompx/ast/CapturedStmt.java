package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * Compiler wrapper around the statement associated with a directive. Combined
 * directives may nest several of these around the same statement.
 */
public class CapturedStmt extends Node {

    private final Node capturedStmt;

    public CapturedStmt(SourceSpan span, Node capturedStmt) {
        super(span);
        this.capturedStmt = capturedStmt;
    }

    public Node getCapturedStmt() {
        return capturedStmt;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(capturedStmt);
    }
}
