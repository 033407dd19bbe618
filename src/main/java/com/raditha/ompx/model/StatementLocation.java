package com.raditha.ompx.model;

/**
 * Position of a statement relative to the innermost indexed loop that contains it.
 *
 * @param filename     file the loop belongs to
 * @param functionName enclosing function
 * @param loopId       per-function loop id of the containing loop
 * @param statementId  1-based rank of the statement inside the loop body
 */
public record StatementLocation(
        String filename,
        String functionName,
        int loopId,
        int statementId) {
}
