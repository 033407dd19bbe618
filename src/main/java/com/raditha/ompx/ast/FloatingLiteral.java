package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;

public class FloatingLiteral extends Node {

    private final String value;

    public FloatingLiteral(SourceSpan span, String value) {
        super(span);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }
}
