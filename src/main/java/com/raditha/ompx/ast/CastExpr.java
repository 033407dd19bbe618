package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * Implicit conversion or explicit C-style cast.
 */
public class CastExpr extends Node {

    private final boolean implicit;
    private final Node operand;

    public CastExpr(SourceSpan span, boolean implicit, Node operand) {
        super(span);
        this.implicit = implicit;
        this.operand = operand;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(operand);
    }
}
