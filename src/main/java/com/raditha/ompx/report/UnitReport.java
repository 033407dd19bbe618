package com.raditha.ompx.report;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;

/**
 * Outcome of flushing one source unit.
 *
 * @param filename         source file the report describes
 * @param output           where the report was (or should have been) written
 * @param loopEntries      number of loop entries
 * @param directiveEntries number of ordered and atomic entries
 * @param written          whether the file was written successfully
 * @param document         the rendered report
 */
public record UnitReport(
        String filename,
        Path output,
        int loopEntries,
        int directiveEntries,
        boolean written,
        ObjectNode document) {

    public int getEntryCount() {
        return loopEntries + directiveEntries;
    }
}
