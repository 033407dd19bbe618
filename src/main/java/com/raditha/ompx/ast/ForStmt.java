package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;
import java.util.Optional;

public class ForStmt extends LoopStmt {

    private final Node init;
    private final Node condition;
    private final Node increment;

    public ForStmt(SourceSpan span, Node init, Node condition, Node increment, Node body) {
        super(span, body);
        this.init = init;
        this.condition = condition;
        this.increment = increment;
    }

    public Optional<Node> getInit() {
        return Optional.ofNullable(init);
    }

    public Optional<Node> getCondition() {
        return Optional.ofNullable(condition);
    }

    public Optional<Node> getIncrement() {
        return Optional.ofNullable(increment);
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(init, condition, increment, getBody());
    }
}
