package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Base class of the statement and expression tree handed over by the front end.
 * <p>
 * Nodes are compared by identity. A node without a usable span is kept in the
 * tree but never produces report output of its own.
 */
public abstract class Node {

    private final SourceSpan span;

    protected Node(SourceSpan span) {
        this.span = span;
    }

    /**
     * The node's span, empty when the front end gave none or an invalid one.
     */
    public Optional<SourceSpan> getSpan() {
        return span != null && span.isValid() ? Optional.of(span) : Optional.empty();
    }

    /**
     * Direct children in source order. Never contains {@code null}.
     */
    public abstract List<Node> getChildren();

    /**
     * Short kind name, used in log messages.
     */
    public String getKindName() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return getKindName() + getSpan().map(s -> " " + s).orElse("");
    }
}
