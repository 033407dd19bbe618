package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * Wrapper the front end puts around constant-evaluated expressions, such as a
 * {@code collapse} count.
 */
public class ConstantExpr extends Node {

    private final Node operand;

    public ConstantExpr(SourceSpan span, Node operand) {
        super(span);
        this.operand = operand;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(operand);
    }
}
