package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

public class DoStmt extends LoopStmt {

    private final Node condition;

    public DoStmt(SourceSpan span, Node body, Node condition) {
        super(span, body);
        this.condition = condition;
    }

    public Node getCondition() {
        return condition;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(getBody(), condition);
    }
}
