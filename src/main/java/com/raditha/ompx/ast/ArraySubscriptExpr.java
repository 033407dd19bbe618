package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

public class ArraySubscriptExpr extends Node {

    private final Node base;
    private final Node index;

    public ArraySubscriptExpr(SourceSpan span, Node base, Node index) {
        super(span);
        this.base = base;
        this.index = index;
    }

    public Node getBase() {
        return base;
    }

    public Node getIndex() {
        return index;
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(base, index);
    }
}
