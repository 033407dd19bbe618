package com.raditha.ompx.model;

import com.raditha.ompx.ast.LoopStmt;

import java.util.Optional;

/**
 * An indexed loop of a function.
 *
 * @param loop              the loop node, which is also the record's identity
 * @param functionName      enclosing function
 * @param loopId            1-based id, in order of start line within the function
 * @param span              source span of the whole loop
 * @param inductionVariable display string of the loop variable, when derivable
 */
public record LoopRecord(
        LoopStmt loop,
        String functionName,
        int loopId,
        SourceSpan span,
        Optional<String> inductionVariable) {
}
