package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * A reference to a declared name.
 */
public class DeclRefExpr extends Node {

    private final String name;

    public DeclRefExpr(SourceSpan span, String name) {
        super(span);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }
}
