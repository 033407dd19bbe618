package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * Binary operator application, plain or compound assignment included.
 */
public class BinaryOperation extends Node {

    private final BinaryOpcode opcode;
    private final Node lhs;
    private final Node rhs;

    public BinaryOperation(SourceSpan span, BinaryOpcode opcode, Node lhs, Node rhs) {
        super(span);
        this.opcode = opcode;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public BinaryOpcode getOpcode() {
        return opcode;
    }

    public Node getLhs() {
        return lhs;
    }

    public Node getRhs() {
        return rhs;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(lhs, rhs);
    }
}
