package com.raditha.ompx.model;

/**
 * Represents a source code span (line and column positions).
 * The end position points at the last character of the node, inclusive.
 *
 * @param startLine   Starting line number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param startColumn Starting column number (1-indexed)
 * @param endColumn   Ending column number (1-indexed, inclusive)
 */
public record SourceSpan(
        int startLine,
        int endLine,
        int startColumn,
        int endColumn) {

    /**
     * A span is usable only when every coordinate is positive and the end does
     * not precede the start.
     */
    public boolean isValid() {
        if (startLine < 1 || endLine < 1 || startColumn < 1 || endColumn < 1) {
            return false;
        }
        return endLine > startLine || (endLine == startLine && endColumn >= startColumn);
    }

    /**
     * Span running from the start of {@code first} to the end of {@code last}.
     */
    public static SourceSpan between(SourceSpan first, SourceSpan last) {
        return new SourceSpan(
                first.startLine,
                last.endLine,
                first.startColumn,
                last.endColumn);
    }

    /**
     * Format as "L45:3-52:1" for display.
     */
    public String toDisplayString() {
        return "L" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
