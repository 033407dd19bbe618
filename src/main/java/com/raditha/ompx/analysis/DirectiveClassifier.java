package com.raditha.ompx.analysis;

import com.raditha.ompx.ast.DirectiveKind;

/**
 * Maps directive kinds to the pragma labels used in reports.
 */
public class DirectiveClassifier {

    private DirectiveClassifier() {
        /* this is only a utility class */
    }

    /**
     * Canonical label of a directive.
     *
     * @param kind                 the directive kind
     * @param insideParallelRegion whether an enclosing {@code parallel} region was seen;
     *                             turns {@code for} into {@code parallel for}
     * @return the label, empty for directives that are not reported by kind
     */
    public static String classify(DirectiveKind kind, boolean insideParallelRegion) {
        return switch (kind) {
            case DISTRIBUTE -> "distribute";
            case DISTRIBUTE_PARALLEL_FOR -> "distribute parallel for";
            case DISTRIBUTE_PARALLEL_FOR_SIMD -> "distribute parallel for simd";
            case DISTRIBUTE_SIMD -> "distribute simd";
            case FOR -> insideParallelRegion ? "parallel for" : "for";
            case FOR_SIMD -> insideParallelRegion ? "parallel for simd" : "for simd";
            case PARALLEL_FOR -> "parallel for";
            case PARALLEL_FOR_SIMD -> "parallel for simd";
            case SIMD -> "simd";
            case TARGET_PARALLEL_FOR -> "target parallel for";
            case TARGET_PARALLEL_FOR_SIMD -> "target parallel for simd";
            case TARGET_SIMD -> "target simd";
            case TARGET_TEAMS_DISTRIBUTE -> "target teams distribute";
            case TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR -> "target teams distribute parallel for";
            case TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR_SIMD -> "target teams distribute parallel for simd";
            case TARGET_TEAMS_DISTRIBUTE_SIMD -> "target teams distribute simd";
            case TASKLOOP -> "taskloop";
            case TASKLOOP_SIMD -> "taskloop simd";
            case TEAMS_DISTRIBUTE -> "teams distribute";
            case TEAMS_DISTRIBUTE_PARALLEL_FOR -> "teams distribute parallel for";
            case TEAMS_DISTRIBUTE_PARALLEL_FOR_SIMD -> "teams distribute parallel for simd";
            case TEAMS_DISTRIBUTE_SIMD -> "teams distribute simd";
            case TARGET_DATA -> "target data";
            case TARGET_ENTER_DATA, TARGET_EXIT_DATA, TARGET_UPDATE, TARGET, TARGET_PARALLEL, TARGET_TEAMS,
                    PARALLEL, PARALLEL_SECTIONS, TEAMS, SECTIONS, SECTION, SINGLE, MASTER, CRITICAL,
                    TASK, TASKWAIT, BARRIER, FLUSH, ORDERED, ATOMIC, OTHER -> "";
        };
    }

    /**
     * Whether the directive starts a region that executes on a device.
     * The data-movement-only directives are not counted.
     */
    public static boolean causesOffload(DirectiveKind kind) {
        return switch (kind) {
            case TARGET_PARALLEL_FOR, TARGET_PARALLEL_FOR_SIMD,
                    TARGET_TEAMS_DISTRIBUTE, TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR,
                    TARGET_TEAMS_DISTRIBUTE_PARALLEL_FOR_SIMD, TARGET_TEAMS_DISTRIBUTE_SIMD,
                    TARGET_PARALLEL, TARGET_TEAMS, TARGET_UPDATE, TARGET -> true;
            case DISTRIBUTE, DISTRIBUTE_PARALLEL_FOR, DISTRIBUTE_PARALLEL_FOR_SIMD, DISTRIBUTE_SIMD,
                    FOR, FOR_SIMD, PARALLEL_FOR, PARALLEL_FOR_SIMD, SIMD, TARGET_SIMD,
                    TASKLOOP, TASKLOOP_SIMD, TEAMS_DISTRIBUTE, TEAMS_DISTRIBUTE_PARALLEL_FOR,
                    TEAMS_DISTRIBUTE_PARALLEL_FOR_SIMD, TEAMS_DISTRIBUTE_SIMD,
                    TARGET_DATA, TARGET_ENTER_DATA, TARGET_EXIT_DATA,
                    PARALLEL, PARALLEL_SECTIONS, TEAMS, SECTIONS, SECTION, SINGLE, MASTER, CRITICAL,
                    TASK, TASKWAIT, BARRIER, FLUSH, ORDERED, ATOMIC, OTHER -> false;
        };
    }
}
