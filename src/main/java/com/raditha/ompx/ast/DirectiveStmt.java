package com.raditha.ompx.ast;

import com.raditha.ompx.model.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * An OpenMP executable directive together with its clauses and associated
 * statement. The span covers the pragma line.
 */
public class DirectiveStmt extends Node {

    private final DirectiveKind kind;
    private final List<OmpClause> clauses;
    private final Node associatedStmt;

    public DirectiveStmt(SourceSpan span, DirectiveKind kind, List<OmpClause> clauses, Node associatedStmt) {
        super(span);
        this.kind = kind;
        this.clauses = List.copyOf(clauses);
        this.associatedStmt = associatedStmt;
    }

    public DirectiveKind getKind() {
        return kind;
    }

    public List<OmpClause> getClauses() {
        return clauses;
    }

    public Optional<OmpClause> getFirstClause() {
        return clauses.isEmpty() ? Optional.empty() : Optional.of(clauses.get(0));
    }

    public Optional<Node> getAssociatedStmt() {
        return Optional.ofNullable(associatedStmt);
    }

    /**
     * The statement inside the innermost captured wrapper; for loop-associated
     * directives this is the outermost loop of the nest.
     */
    public Optional<Node> getInnermostCapturedStmt() {
        Node current = associatedStmt;
        while (current instanceof CapturedStmt captured) {
            current = captured.getCapturedStmt();
        }
        return Optional.ofNullable(current);
    }

    @Override
    public List<Node> getChildren() {
        return Nodes.present(associatedStmt);
    }

    @Override
    public String getKindName() {
        return kind.nodeKind().isEmpty() ? "OMPDirective" : kind.nodeKind();
    }
}
