package com.raditha.ompx.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of OpenMP executable directives the extractor distinguishes.
 * Anything else the front end reports maps to {@link #OTHER}.
 */
public enum DirectiveKind {
    DISTRIBUTE("OMPDistributeDirective", true),
    DISTRIBUTE_PARALLEL_FOR("OMPDistributeParallelForDirective", true),
    DISTRIBUTE_PARALLEL_FOR_SIMD("OMPDistributeParallelForSimdDirective", true),
    DISTRIBUTE_SIMD("OMPDistributeSimdDirective", true),
    FOR("OMPForDirective", true),
    FOR_SIMD("OMPForSimdDirective", true),
    PARALLEL_FOR("OMPParallelForDirective", true),
    PARALLEL_FOR_SIMD("OMPParallelForSimdDirective", true),
    SIMD("OMPSimdDirective", true),
    TARGET_PARALLEL_FOR("OMPTargetParallelForDirective", true),
    TARGET_PARALLEL_FOR_SIMD("OMPTargetParallelForSimdDirective", true),
    TARGET_SIMD("OMPTargetSimdDirective", true),
    TARGET_TEAMS_DISTRIBUTE("OMPTargetTeamsDistributeDirective", true),
    TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR("OMPTargetTeamsDistributeParallelForDirective", true),
    TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR_SIMD("OMPTargetTeamsDistributeParallelForSimdDirective", true),
    TARGET_TEAMS_DISTRIBUTE_SIMD("OMPTargetTeamsDistributeSimdDirective", true),
    TASKLOOP("OMPTaskLoopDirective", true),
    TASKLOOP_SIMD("OMPTaskLoopSimdDirective", true),
    TEAMS_DISTRIBUTE("OMPTeamsDistributeDirective", true),
    TEAMS_DISTRIBUTE_PARALLEL_FOR("OMPTeamsDistributeParallelForDirective", true),
    TEAMS_DISTRIBUTE_PARALLEL_FOR_SIMD("OMPTeamsDistributeParallelForSimdDirective", true),
    TEAMS_DISTRIBUTE_SIMD("OMPTeamsDistributeSimdDirective", true),

    TARGET_DATA("OMPTargetDataDirective", false),
    TARGET_ENTER_DATA("OMPTargetEnterDataDirective", false),
    TARGET_EXIT_DATA("OMPTargetExitDataDirective", false),
    TARGET_UPDATE("OMPTargetUpdateDirective", false),
    TARGET("OMPTargetDirective", false),
    TARGET_PARALLEL("OMPTargetParallelDirective", false),
    TARGET_TEAMS("OMPTargetTeamsDirective", false),
    PARALLEL("OMPParallelDirective", false),
    PARALLEL_SECTIONS("OMPParallelSectionsDirective", false),
    TEAMS("OMPTeamsDirective", false),
    SECTIONS("OMPSectionsDirective", false),
    SECTION("OMPSectionDirective", false),
    SINGLE("OMPSingleDirective", false),
    MASTER("OMPMasterDirective", false),
    CRITICAL("OMPCriticalDirective", false),
    TASK("OMPTaskDirective", false),
    TASKWAIT("OMPTaskwaitDirective", false),
    BARRIER("OMPBarrierDirective", false),
    FLUSH("OMPFlushDirective", false),
    ORDERED("OMPOrderedDirective", false),
    ATOMIC("OMPAtomicDirective", false),
    OTHER("", false);

    private static final Map<String, DirectiveKind> BY_NODE_KIND = Arrays.stream(values())
            .filter(kind -> !kind.nodeKind.isEmpty())
            .collect(Collectors.toMap(kind -> kind.nodeKind, Function.identity()));

    private final String nodeKind;
    private final boolean loopAssociated;

    DirectiveKind(String nodeKind, boolean loopAssociated) {
        this.nodeKind = nodeKind;
        this.loopAssociated = loopAssociated;
    }

    /**
     * Name of the corresponding clang AST class.
     */
    public String nodeKind() {
        return nodeKind;
    }

    /**
     * True for directives whose associated statement is a loop nest.
     */
    public boolean isLoopAssociated() {
        return loopAssociated;
    }

    /**
     * True for the directives that only move data between host and device.
     */
    public boolean isDataEnvironment() {
        return this == TARGET_DATA || this == TARGET_ENTER_DATA || this == TARGET_EXIT_DATA;
    }

    public static Optional<DirectiveKind> fromNodeKind(String nodeKind) {
        return Optional.ofNullable(BY_NODE_KIND.get(nodeKind));
    }
}
