package com.raditha.ompx.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Clauses the extractor understands. Every other clause is {@link #OTHER} and
 * is carried through without effect.
 */
public enum ClauseKind {
    IF("OMPIfClause"),
    FINAL("OMPFinalClause"),
    COLLAPSE("OMPCollapseClause"),
    ORDERED("OMPOrderedClause"),
    PRIVATE("OMPPrivateClause"),
    SHARED("OMPSharedClause"),
    FIRSTPRIVATE("OMPFirstprivateClause"),
    LASTPRIVATE("OMPLastprivateClause"),
    LINEAR("OMPLinearClause"),
    REDUCTION("OMPReductionClause"),
    MAP("OMPMapClause"),
    CAPTURE("OMPCaptureClause"),
    WRITE("OMPWriteClause"),
    READ("OMPReadClause"),
    UPDATE("OMPUpdateClause"),
    OTHER("");

    private static final Map<String, ClauseKind> BY_NODE_KIND = Arrays.stream(values())
            .filter(kind -> !kind.nodeKind.isEmpty())
            .collect(Collectors.toMap(kind -> kind.nodeKind, Function.identity()));

    private final String nodeKind;

    ClauseKind(String nodeKind) {
        this.nodeKind = nodeKind;
    }

    public String nodeKind() {
        return nodeKind;
    }

    public static Optional<ClauseKind> fromNodeKind(String nodeKind) {
        return Optional.ofNullable(BY_NODE_KIND.get(nodeKind));
    }
}
