package com.raditha.ompx.extraction;

import com.raditha.ompx.model.SourceSpan;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Cuts source text for a span out of a {@link SourceBuffer}.
 * <p>
 * The span of an expression statement stops before its terminator, so the end
 * can be pushed forward to the next {@code ;} or {@code }} to include it.
 */
public class SnippetExtractor {

    private final boolean enabled;

    /**
     * @param enabled whether report snippets are produced; raw extraction for
     *                statement numbering is not affected
     */
    public SnippetExtractor(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Raw text of a span.
     *
     * @param buffer source text
     * @param span   span to cut, end inclusive
     * @param extend push the end forward to the next {@code ;} or {@code }}
     * @return the text, empty when the span does not fit the buffer
     */
    public Optional<String> extract(SourceBuffer buffer, SourceSpan span, boolean extend) {
        if (buffer == null || span == null || !span.isValid()) {
            return Optional.empty();
        }
        OptionalInt begin = buffer.offsetOf(span.startLine(), span.startColumn());
        OptionalInt end = buffer.offsetOf(span.endLine(), span.endColumn());
        if (begin.isEmpty() || end.isEmpty() || end.getAsInt() < begin.getAsInt()) {
            return Optional.empty();
        }
        int last = end.getAsInt();
        if (extend) {
            while (last < buffer.length() - 1) {
                char c = buffer.charAt(last);
                if (c == ';' || c == '}') {
                    break;
                }
                last++;
            }
        }
        return Optional.of(buffer.text().substring(begin.getAsInt(), last + 1));
    }

    /**
     * Snippet as it appears in a report: extended, trimmed and split into lines.
     *
     * @return the lines, empty when snippets are disabled or the span is unusable
     */
    public List<String> snippetLines(SourceBuffer buffer, SourceSpan span) {
        if (!enabled) {
            return List.of();
        }
        return extract(buffer, span, true)
                .map(String::trim)
                .map(text -> Arrays.asList(text.split("\\r?\\n", -1)))
                .orElse(List.of());
    }
}
