package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * OpenMP array section {@code base[lower:length]}; both bounds may be omitted.
 */
public class ArraySectionExpr extends Node {

    private final Node base;
    private final Node lowerBound;
    private final Node length;

    public ArraySectionExpr(SourceSpan span, Node base, Node lowerBound, Node length) {
        super(span);
        this.base = base;
        this.lowerBound = lowerBound;
        this.length = length;
    }

    public Node getBase() {
        return base;
    }

    public Optional<Node> getLowerBound() {
        return Optional.ofNullable(lowerBound);
    }

    public Optional<Node> getLength() {
        return Optional.ofNullable(length);
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(base, lowerBound, length);
    }
}
