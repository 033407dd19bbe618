package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * Unary operator application such as {@code i++}, {@code --n} or {@code -x}.
 */
public class UnaryOperation extends Node {

    private final String opcode;
    private final boolean postfix;
    private final Node operand;

    public UnaryOperation(SourceSpan span, String opcode, boolean postfix, Node operand) {
        super(span);
        this.opcode = opcode;
        this.postfix = postfix;
        this.operand = operand;
    }

    public String getOpcode() {
        return opcode;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(operand);
    }
}
