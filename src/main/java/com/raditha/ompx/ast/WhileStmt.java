package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

public class WhileStmt extends LoopStmt {

    private final Node condition;

    public WhileStmt(SourceSpan span, Node condition, Node body) {
        super(span, body);
        this.condition = condition;
    }

    public Node getCondition() {
        return condition;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(condition, getBody());
    }
}
