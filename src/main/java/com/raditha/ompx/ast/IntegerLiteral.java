package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.math.BigInteger;
import java.util.List;

public class IntegerLiteral extends Node {

    private final BigInteger value;

    public IntegerLiteral(SourceSpan span, BigInteger value) {
        super(span);
        this.value = value;
    }

    public IntegerLiteral(SourceSpan span, long value) {
        this(span, BigInteger.valueOf(value));
    }

    /**
     * Unsigned 64-bit literals do not fit in a {@code long}.
     */
    public BigInteger getValue() {
        return value;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }
}
