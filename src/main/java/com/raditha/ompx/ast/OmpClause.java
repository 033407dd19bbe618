package com.raditha.ompx.ast;

import java.util.List;
import java.util.Optional;

/**
 * A clause of a directive. Clauses are not statements and never appear among
 * the children of a node.
 */
public class OmpClause {

    private final ClauseKind kind;
    private final boolean implicit;
    private final List<Node> operands;
    private final String reductionOperator;
    private final MapType mapType;

    public OmpClause(ClauseKind kind, boolean implicit, List<Node> operands,
                     String reductionOperator, MapType mapType) {
        this.kind = kind;
        this.implicit = implicit;
        this.operands = List.copyOf(operands);
        this.reductionOperator = reductionOperator;
        this.mapType = mapType;
    }

    public OmpClause(ClauseKind kind, List<Node> operands) {
        this(kind, false, operands, null, null);
    }

    public static OmpClause reduction(String operator, List<Node> operands) {
        return new OmpClause(ClauseKind.REDUCTION, false, operands, operator, null);
    }

    public static OmpClause map(MapType mapType, List<Node> operands) {
        return new OmpClause(ClauseKind.MAP, false, operands, null, mapType);
    }

    public ClauseKind getKind() {
        return kind;
    }

    /**
     * True when the compiler synthesized the clause rather than the user writing it.
     */
    public boolean isImplicit() {
        return implicit;
    }

    public List<Node> getOperands() {
        return operands;
    }

    public Optional<String> getReductionOperator() {
        return Optional.ofNullable(reductionOperator);
    }

    public Optional<MapType> getMapType() {
        return Optional.ofNullable(mapType);
    }

    @Override
    public String toString() {
        return kind + (implicit ? " (implicit)" : "") + " " + operands.size() + " operand(s)";
    }
}
