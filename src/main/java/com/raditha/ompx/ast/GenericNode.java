package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

/**
 * Any statement or expression the extractor has no special rule for (calls,
 * returns, declarations, conditionals...). It only contributes its children.
 */
public class GenericNode extends Node {

    private final String kindName;
    private final List<Node> children;

    public GenericNode(SourceSpan span, String kindName, List<Node> children) {
        super(span);
        this.kindName = kindName;
        this.children = List.copyOf(children);
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    public String getKindName() {
        return kindName;
    }
}
